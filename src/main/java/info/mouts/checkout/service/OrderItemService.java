package info.mouts.checkout.service;

import java.util.List;
import java.util.UUID;

import info.mouts.checkout.domain.OrderItem;

public interface OrderItemService {
    /**
     * Finds all order items for a given order ID.
     *
     * @param orderId The ID of the order to find items for.
     * @return A list of all order items for the given order ID.
     */
    List<OrderItem> findOrderItemsByOrderId(UUID orderId);
}
