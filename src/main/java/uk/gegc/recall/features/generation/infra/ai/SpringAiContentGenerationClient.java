package uk.gegc.recall.features.generation.infra.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import uk.gegc.recall.features.concept.domain.model.ContentType;
import uk.gegc.recall.features.generation.application.ContentGenerationClient;
import uk.gegc.recall.features.generation.application.dto.ConceptIdea;
import uk.gegc.recall.features.generation.application.dto.GeneratedPhrasing;
import uk.gegc.recall.features.generation.application.dto.PhrasingGenerationRequest;
import uk.gegc.recall.shared.config.AiRateLimitConfig;
import uk.gegc.recall.shared.exception.AIResponseParseException;
import uk.gegc.recall.shared.exception.AiServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spring AI implementation of {@link ContentGenerationClient}.
 * <p>
 * Each model call runs on the {@code aiCallExecutor} so the caller can give up after
 * {@code ai.rate-limit.call-timeout-seconds}. Rate-limited calls are retried with exponential
 * backoff and jitter; every other failure is thrown to the caller for classification.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SpringAiContentGenerationClient implements ContentGenerationClient {

    private final ChatClient chatClient;
    private final GenerationPromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;
    private final AiRateLimitConfig rateLimitConfig;

    @Qualifier("aiCallExecutor")
    private final Executor aiCallExecutor;

    @Override
    public List<ConceptIdea> synthesizeConcepts(String prompt) {
        String userPrompt = promptBuilder.buildConceptSynthesisPrompt(prompt);
        String raw = callWithRetry(userPrompt, "concept synthesis");
        return parseConceptIdeas(raw);
    }

    @Override
    public List<GeneratedPhrasing> generatePhrasings(PhrasingGenerationRequest request) {
        String userPrompt = promptBuilder.buildPhrasingGenerationPrompt(request);
        String raw = callWithRetry(userPrompt, "phrasing generation");
        return parsePhrasings(raw);
    }

    private String callWithRetry(String userPrompt, String operation) {
        int maxRetries = Math.max(1, rateLimitConfig.getMaxRetries());
        int retryCount = 0;

        while (true) {
            try {
                return callModel(userPrompt);
            } catch (RuntimeException e) {
                if (!isRateLimitError(e)) {
                    throw e;
                }
                if (retryCount >= maxRetries - 1) {
                    log.error("{} still rate limited after {} attempts", operation, maxRetries);
                    throw new AiServiceException(
                            "Rate limit exceeded after " + maxRetries + " attempts: " + e.getMessage(), e);
                }
                long delayMs = calculateBackoffDelay(retryCount);
                log.warn("Rate limit hit for {} (attempt {}). Waiting {} ms", operation, retryCount + 1, delayMs);
                sleepForRateLimit(delayMs);
                retryCount++;
            }
        }
    }

    private String callModel(String userPrompt) {
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(promptBuilder.buildSystemPrompt()),
                new UserMessage(userPrompt)
        ));

        CompletableFuture<ChatResponse> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> chatClient.prompt(prompt).call().chatResponse(), aiCallExecutor);
        } catch (RejectedExecutionException e) {
            throw new AiServiceException("Too many concurrent model calls (rate limit)", e);
        }

        ChatResponse response;
        long timeoutSeconds = rateLimitConfig.getCallTimeoutSeconds();
        try {
            response = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AiServiceException("Model call timeout after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AiServiceException("Interrupted while waiting for model response", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AiServiceException("Model call failed: " + cause.getMessage(), cause);
        }

        if (response == null || response.getResult() == null) {
            throw new AiServiceException("No response received from AI service");
        }
        String rawResponse = response.getResult().getOutput().getText();
        if (rawResponse == null || rawResponse.trim().isEmpty()) {
            throw new AiServiceException("Empty response received from AI service");
        }
        return rawResponse;
    }

    List<ConceptIdea> parseConceptIdeas(String rawResponse) {
        JsonNode items = readArray(rawResponse, "concepts");
        List<ConceptIdea> ideas = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            if (!item.isObject()) {
                log.warn("Skipping concept {} in model output: not an object", i);
                continue;
            }
            ideas.add(new ConceptIdea(
                    text(item, "title"),
                    text(item, "description"),
                    text(item, "whyItMatters"),
                    parseContentType(text(item, "contentType")),
                    text(item, "originIntent")
            ));
        }
        return ideas;
    }

    List<GeneratedPhrasing> parsePhrasings(String rawResponse) {
        JsonNode items = readArray(rawResponse, "phrasings");
        List<GeneratedPhrasing> phrasings = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            JsonNode item = items.get(i);
            if (!item.isObject()) {
                log.warn("Skipping phrasing {} in model output: not an object", i);
                continue;
            }
            JsonNode optionsNode = item.path("options");
            if (!optionsNode.isArray()) {
                log.warn("Skipping phrasing {} in model output: 'options' is not an array", i);
                continue;
            }
            List<String> options = new ArrayList<>();
            for (JsonNode option : optionsNode) {
                if (option.isValueNode() && !option.isNull()) {
                    options.add(option.asText());
                }
            }
            phrasings.add(new GeneratedPhrasing(
                    text(item, "question"),
                    text(item, "explanation"),
                    text(item, "type"),
                    options,
                    text(item, "correctAnswer")
            ));
        }
        return phrasings;
    }

    private JsonNode readArray(String rawResponse, String field) {
        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJsonResponse(rawResponse));
        } catch (JsonProcessingException e) {
            throw new AIResponseParseException("Failed to parse model response as JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.has(field)) {
            throw new AIResponseParseException("Response missing '" + field + "' field");
        }
        JsonNode items = root.get(field);
        if (!items.isArray()) {
            throw new AIResponseParseException("'" + field + "' field must be an array");
        }
        return items;
    }

    /**
     * Clean JSON response by removing markdown code blocks
     */
    private String cleanJsonResponse(String response) {
        String cleaned = response.trim();

        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }

        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }

        return cleaned.trim();
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private ContentType parseContentType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ContentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown content type '{}' in model output", value);
            return null;
        }
    }

    /**
     * Check if exception is a rate limit error
     */
    boolean isRateLimitError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }

        return message.contains("429") ||
                message.contains("rate limit") ||
                message.contains("rate_limit_exceeded") ||
                message.contains("Too Many Requests");
    }

    /**
     * Calculate exponential backoff delay with jitter
     */
    long calculateBackoffDelay(int retryCount) {
        long exponentialDelay = rateLimitConfig.getBaseDelayMs() * (long) Math.pow(2, retryCount);

        double jitterRange = rateLimitConfig.getJitterFactor();
        double jitter = (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);

        long delayWithJitter = (long) (exponentialDelay * jitter);

        return Math.min(delayWithJitter, rateLimitConfig.getMaxDelayMs());
    }

    protected void sleepForRateLimit(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while waiting for rate limit", ie);
        }
    }
}
