package info.mouts.checkout.domain;

import java.util.Locale;

/**
 * Normalized meaning of a processor event type.
 */
public enum PaymentOutcome {
    PAYMENT_SUCCEEDED,
    PAYMENT_FAILED,
    UNKNOWN;

    /**
     * Maps a processor event type to its outcome. Both the fully qualified
     * ({@code payment_intent.succeeded}) and the short ({@code succeeded}) forms
     * are accepted. A cancelled intent counts as a failed payment.
     *
     * @param eventType The raw event type, may be {@code null}.
     * @return The interpreted outcome, {@link #UNKNOWN} if unrecognized.
     */
    public static PaymentOutcome fromEventType(String eventType) {
        if (eventType == null) {
            return UNKNOWN;
        }

        switch (eventType.trim().toLowerCase(Locale.ROOT)) {
            case "payment_intent.succeeded":
            case "succeeded":
                return PAYMENT_SUCCEEDED;
            case "payment_intent.payment_failed":
            case "payment_failed":
            case "failed":
            case "payment_intent.canceled":
            case "canceled":
                return PAYMENT_FAILED;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Status the order should reach for this outcome.
     *
     * @return The target status, or {@code null} for {@link #UNKNOWN}.
     */
    public OrderStatus targetStatus() {
        switch (this) {
            case PAYMENT_SUCCEEDED:
                return OrderStatus.PAID;
            case PAYMENT_FAILED:
                return OrderStatus.FAILED;
            default:
                return null;
        }
    }
}
