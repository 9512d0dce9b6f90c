package uk.gegc.recall.features.generation.infra.ai;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.generation.application.dto.PhrasingGenerationRequest;
import uk.gegc.recall.shared.config.GenerationJobProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds model prompts from the templates under {@code classpath:prompts/}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GenerationPromptBuilder {

    private final ResourceLoader resourceLoader;
    private final GenerationJobProperties jobProperties;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    public String buildSystemPrompt() {
        return loadPromptTemplate("system-prompt.txt");
    }

    public String buildConceptSynthesisPrompt(String learnerPrompt) {
        if (learnerPrompt == null || learnerPrompt.isBlank()) {
            throw new IllegalArgumentException("Prompt cannot be empty");
        }
        return loadPromptTemplate("concept-synthesis.txt")
                .replace("{maxConcepts}", String.valueOf(jobProperties.getMaxConceptsPerGeneration()))
                .replace("{prompt}", learnerPrompt);
    }

    public String buildPhrasingGenerationPrompt(PhrasingGenerationRequest request) {
        if (request.targetCount() <= 0) {
            throw new IllegalArgumentException("Target count must be positive");
        }
        return loadPromptTemplate("phrasing-generation.txt")
                .replace("{targetCount}", String.valueOf(request.targetCount()))
                .replace("{contentType}", request.contentType() == null
                        ? "unspecified"
                        : request.contentType().name().toLowerCase(Locale.ROOT))
                .replace("{originIntent}", orDefault(request.originIntent(), "not provided"))
                .replace("{conceptDescription}", orDefault(request.conceptDescription(), "not provided"))
                .replace("{existingQuestions}", existingBlock(request.existingQuestions()))
                .replace("{conceptTitle}", request.conceptTitle());
    }

    String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new UncheckedIOException("Failed to load template: " + templateName, e);
        }
    }

    private String existingBlock(List<String> existingQuestions) {
        if (existingQuestions == null || existingQuestions.isEmpty()) {
            return "None (generate first phrasings for this concept)";
        }
        StringBuilder block = new StringBuilder();
        for (int i = 0; i < existingQuestions.size(); i++) {
            if (i > 0) {
                block.append('\n');
            }
            block.append(i + 1).append(". ").append(existingQuestions.get(i));
        }
        return block.toString();
    }

    private String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
