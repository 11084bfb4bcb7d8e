package info.mouts.checkout.exception;

import java.util.UUID;

public class OrderAccessDeniedException extends RuntimeException {
    public OrderAccessDeniedException(UUID orderId, String userId) {
        super("User " + userId + " is not allowed to access order " + orderId);
    }

    public OrderAccessDeniedException(String message) {
        super(message);
    }
}
