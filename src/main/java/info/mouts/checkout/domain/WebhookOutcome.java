package info.mouts.checkout.domain;

/**
 * Result of handling one verified webhook delivery. Every value is
 * acknowledged to the processor with HTTP 200.
 */
public enum WebhookOutcome {
    /** The event moved the order to its target status. */
    APPLIED,
    /** The order was already in the target status. */
    ALREADY_APPLIED,
    /** The event id was seen before. */
    DUPLICATE,
    /** Unrecognized event type or unusable payload. */
    IGNORED,
    /** No order holds the referenced payment intent. */
    ORDER_NOT_FOUND,
    /** The order had moved to a status the event can no longer change. */
    STALE
}
