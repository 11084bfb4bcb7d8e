package info.mouts.checkout.exception;

import java.util.UUID;

public class OrderNotFoundException extends RuntimeException {
    public OrderNotFoundException(UUID orderId) {
        super("Order not found for ID: " + orderId);
    }

    public OrderNotFoundException(String orderNumber) {
        super("Order not found for number: " + orderNumber);
    }
}
