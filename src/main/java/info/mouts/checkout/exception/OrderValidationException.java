package info.mouts.checkout.exception;

/**
 * Thrown when an order cannot be created from the given line items, e.g. an
 * empty cart, a non-positive quantity or a product the catalog does not sell.
 */
public class OrderValidationException extends RuntimeException {
    public OrderValidationException(String message) {
        super(message);
    }
}
