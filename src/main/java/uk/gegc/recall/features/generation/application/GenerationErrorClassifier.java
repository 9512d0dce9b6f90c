package uk.gegc.recall.features.generation.application;

import org.springframework.stereotype.Component;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;
import uk.gegc.recall.shared.exception.AIResponseParseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps step failures to a persisted error code, a retry hint and a user-facing message.
 */
@Component
public class GenerationErrorClassifier {

    public enum Stage {
        CONCEPT_SYNTHESIS,
        PHRASING_GENERATION
    }

    public record Classification(GenerationErrorCode code, boolean retryable, String userMessage) {
    }

    public Classification classify(Throwable error, Stage stage) {
        if (error instanceof GenerationPipelineException pipelineError) {
            return new Classification(pipelineError.getCode(), pipelineError.isRetryable(), pipelineError.getMessage());
        }

        GenerationErrorCode code = classifyCode(error);
        boolean retryable = switch (code) {
            case SCHEMA_VALIDATION, RATE_LIMIT, NETWORK -> true;
            case API_KEY, UNKNOWN -> false;
        };
        return new Classification(code, retryable, userMessage(code, stage, error));
    }

    GenerationErrorCode classifyCode(Throwable error) {
        if (hasCause(error, AIResponseParseException.class)) {
            return GenerationErrorCode.SCHEMA_VALIDATION;
        }
        if (hasCause(error, TimeoutException.class) || hasCause(error, SocketTimeoutException.class)) {
            return GenerationErrorCode.NETWORK;
        }

        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);

        if (message.contains("schema")
                || message.contains("validation")
                || message.contains("does not match validator")
                || message.contains("parse")) {
            return GenerationErrorCode.SCHEMA_VALIDATION;
        }
        if (message.contains("rate limit") || message.contains("429") || message.contains("quota")) {
            return GenerationErrorCode.RATE_LIMIT;
        }
        if (message.contains("api key") || message.contains("401") || message.contains("unauthorized")) {
            return GenerationErrorCode.API_KEY;
        }
        if (message.contains("network") || message.contains("timeout") || message.contains("etimedout")) {
            return GenerationErrorCode.NETWORK;
        }
        return GenerationErrorCode.UNKNOWN;
    }

    private String userMessage(GenerationErrorCode code, Stage stage, Throwable error) {
        return switch (code) {
            case SCHEMA_VALIDATION -> stage == Stage.CONCEPT_SYNTHESIS
                    ? "The AI generated concepts in an unexpected format. Please try again with a slightly different prompt."
                    : "The AI generated phrasings in an unexpected format. Please try again shortly.";
            case RATE_LIMIT -> "Rate limit reached. Please wait a moment and try again.";
            case API_KEY -> "API configuration error. Please contact support.";
            case NETWORK -> "Network error. Please check your connection and try again.";
            case UNKNOWN -> error.getMessage() == null ? "Generation failed unexpectedly." : error.getMessage();
        };
    }

    private boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
