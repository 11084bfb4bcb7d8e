package info.mouts.checkout.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Represents the current status of an order in its payment lifecycle.
 * <p>
 * The allowed edges form a small directed graph:
 *
 * <pre>
 * PENDING -> PAYMENT_PROCESSING -> PAID -> REFUNDED
 *                               \-> FAILED
 * PENDING -> CANCELLED
 * </pre>
 */
public enum OrderStatus {
    /**
     * Order created from the cart, no payment intent assigned yet.
     */
    PENDING,

    /**
     * A payment intent was opened at the processor and the order waits for its
     * confirmation webhook.
     */
    PAYMENT_PROCESSING,

    /**
     * Payment confirmed by a verified webhook.
     */
    PAID,

    /**
     * Payment reported as failed or cancelled by the processor. Terminal.
     */
    FAILED,

    /**
     * Unpaid order cancelled by its owner or an administrator. Terminal.
     */
    CANCELLED,

    /**
     * Paid order refunded in full. Terminal.
     */
    REFUNDED;

    /**
     * Returns the statuses reachable from this one in a single transition.
     *
     * @return The set of allowed target statuses, empty for terminal statuses.
     */
    public Set<OrderStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PAYMENT_PROCESSING, CANCELLED);
            case PAYMENT_PROCESSING:
                return EnumSet.of(PAID, FAILED);
            case PAID:
                return EnumSet.of(REFUNDED);
            default:
                return EnumSet.noneOf(OrderStatus.class);
        }
    }

    /**
     * Checks whether {@code target} can be reached from this status in one
     * transition.
     *
     * @param target The desired status.
     * @return {@code true} if the edge exists.
     */
    public boolean canTransitionTo(OrderStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
