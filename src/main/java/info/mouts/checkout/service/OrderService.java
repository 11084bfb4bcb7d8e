package info.mouts.checkout.service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.dto.OrderItemRequestDTO;
import info.mouts.checkout.dto.OrdersSummaryDTO;

/**
 * Store of orders and sole owner of their status transitions.
 */
public interface OrderService {
    /**
     * Creates a {@code PENDING} order, snapshotting the current catalog price of
     * every line and computing the total server-side.
     *
     * @param userId    The owner of the order.
     * @param lineItems The requested lines.
     * @return The persisted order.
     */
    Order createOrder(String userId, List<OrderItemRequestDTO> lineItems);

    Order findByOrderId(UUID orderId);

    Order findByOrderNumber(String orderNumber);

    Optional<Order> findByPaymentIntentId(String paymentIntentId);

    /**
     * Moves an order from {@code from} to {@code to} if, and only if, it still
     * holds {@code from}.
     *
     * @param orderId The order to change.
     * @param from    The status the caller believes the order holds.
     * @param to      The target status.
     * @return The order after the change.
     */
    Order transitionStatus(UUID orderId, OrderStatus from, OrderStatus to);

    /**
     * Same as {@link #transitionStatus(UUID, OrderStatus, OrderStatus)}, also
     * recording why the order failed or was cancelled.
     */
    Order transitionStatus(UUID orderId, OrderStatus from, OrderStatus to, String reason);

    /**
     * Assigns the payment intent and moves the order from {@code PENDING} to
     * {@code PAYMENT_PROCESSING} as one atomic change.
     *
     * @param orderId         The order to change.
     * @param paymentIntentId The intent opened at the processor.
     * @return The order after the change.
     */
    Order assignPaymentIntent(UUID orderId, String paymentIntentId);

    /**
     * Lists the user's orders, newest first unless the page requests another
     * order.
     */
    Page<Order> findOrdersForUser(String userId, Pageable pageable);

    Page<Order> findAll(Pageable pageable);

    /**
     * Aggregates the orders created in the last {@code days} days: how many,
     * how many per status and the revenue of those that were paid.
     *
     * @param days Length of the period, counted back from now.
     */
    OrdersSummaryDTO summarizeOrders(int days);
}
