package info.mouts.checkout.exception;

import info.mouts.checkout.domain.OrderStatus;
import lombok.Getter;

@Getter
public class InvalidStatusTransitionException extends RuntimeException {
    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidStatusTransitionException(OrderStatus from, OrderStatus to) {
        super("Transition from " + from + " to " + to + " is not allowed");
        this.from = from;
        this.to = to;
    }
}
