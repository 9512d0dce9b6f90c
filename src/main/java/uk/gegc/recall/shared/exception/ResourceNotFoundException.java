package uk.gegc.recall.shared.exception;

/**
 * Thrown when a requested record does not exist or is not visible to the calling user.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
