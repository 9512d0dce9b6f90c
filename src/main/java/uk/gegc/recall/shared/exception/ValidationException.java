package uk.gegc.recall.shared.exception;

/**
 * Thrown when a request is well-formed but violates a domain rule.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
