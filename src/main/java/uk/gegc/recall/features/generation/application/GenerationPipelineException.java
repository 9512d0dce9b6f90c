package uk.gegc.recall.features.generation.application;

import lombok.Getter;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;

/**
 * A pipeline failure that already carries its classification. The message is shown to the user as is.
 */
@Getter
public class GenerationPipelineException extends RuntimeException {

    private final GenerationErrorCode code;
    private final boolean retryable;

    public GenerationPipelineException(String message, GenerationErrorCode code, boolean retryable) {
        super(message);
        this.code = code;
        this.retryable = retryable;
    }
}
