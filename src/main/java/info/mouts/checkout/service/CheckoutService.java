package info.mouts.checkout.service;

import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.Requester;
import info.mouts.checkout.dto.CheckoutResponseDTO;
import info.mouts.checkout.dto.OrdersSummaryDTO;

/**
 * Customer-facing order operations: checkout, order queries and the
 * administrative paths.
 */
public interface CheckoutService {
    /**
     * Turns the user's cart into a {@code PENDING} order and opens a payment
     * intent for it. If the processor call fails the order stays
     * {@code PENDING} and can be retried.
     *
     * @param userId The authenticated user.
     * @return The order id and the client secret to confirm the payment with.
     */
    CheckoutResponseDTO initiateCheckout(String userId);

    OrderStatus getOrderStatus(UUID orderId, Requester requester);

    Order getOrder(UUID orderId, Requester requester);

    /**
     * Looks an order up by its order number, for its owner or an administrator.
     */
    Order getOrderByNumber(String orderNumber, Requester requester);

    Page<Order> listOrdersForUser(String userId, Pageable pageable);

    Page<Order> listAllOrders(Requester requester, Pageable pageable);

    /**
     * Summarizes the orders created in the last {@code days} days.
     * Administrators only.
     */
    OrdersSummaryDTO getOrdersSummary(Requester requester, int days);

    /**
     * Opens a new payment intent for an owned order that is still
     * {@code PENDING}, e.g. after the processor was unreachable during checkout.
     */
    CheckoutResponseDTO retryPayment(UUID orderId, Requester requester);

    Order cancelOrder(UUID orderId, Requester requester, String reason);

    /**
     * Refunds a paid order in full. Administrators only.
     */
    Order refundOrder(UUID orderId, Requester requester);
}
