package uk.gegc.recall.shared.exception;

/**
 * Exception thrown when the content-generation service call fails
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
