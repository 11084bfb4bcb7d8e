package info.mouts.checkout.exception;

/**
 * Thrown when the payment processor cannot be reached, times out or rejects a
 * request.
 */
public class PaymentGatewayException extends RuntimeException {
    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
