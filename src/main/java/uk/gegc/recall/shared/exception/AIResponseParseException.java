package uk.gegc.recall.shared.exception;

/**
 * Exception thrown when a generation response cannot be parsed against its expected schema
 */
public class AIResponseParseException extends RuntimeException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
