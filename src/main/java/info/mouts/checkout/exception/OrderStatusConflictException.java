package info.mouts.checkout.exception;

import java.util.UUID;

import info.mouts.checkout.domain.OrderStatus;
import lombok.Getter;

/**
 * Thrown when a conditional status update matched no row because the order no
 * longer holds the expected status. Carries the status actually observed so
 * that callers can tell an already-applied change from a stale one.
 */
@Getter
public class OrderStatusConflictException extends RuntimeException {
    private final UUID orderId;
    private final OrderStatus expectedStatus;
    private final OrderStatus actualStatus;

    public OrderStatusConflictException(UUID orderId, OrderStatus expectedStatus, OrderStatus actualStatus) {
        super("Order " + orderId + " was expected in status " + expectedStatus + " but is " + actualStatus);
        this.orderId = orderId;
        this.expectedStatus = expectedStatus;
        this.actualStatus = actualStatus;
    }
}
