package info.mouts.checkout.event;

import org.springframework.context.ApplicationEvent;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import lombok.Getter;

/**
 * Internal event published when an order is created or changes status.
 */
@Getter
public class OrderStatusChangedEvent extends ApplicationEvent {
    private final Order order;
    private final OrderStatus previousStatus;

    public OrderStatusChangedEvent(Object source, Order order, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.previousStatus = previousStatus;
    }

}
