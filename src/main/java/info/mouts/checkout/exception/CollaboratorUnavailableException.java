package info.mouts.checkout.exception;

/**
 * Thrown when the cart or catalog service cannot answer.
 */
public class CollaboratorUnavailableException extends RuntimeException {
    public CollaboratorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
