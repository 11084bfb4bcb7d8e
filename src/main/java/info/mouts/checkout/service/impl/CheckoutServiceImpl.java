package info.mouts.checkout.service.impl;

import java.util.List;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import info.mouts.checkout.client.CartClient;
import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.Requester;
import info.mouts.checkout.dto.CartItemDTO;
import info.mouts.checkout.dto.CheckoutResponseDTO;
import info.mouts.checkout.dto.OrdersSummaryDTO;
import info.mouts.checkout.exception.OrderAccessDeniedException;
import info.mouts.checkout.exception.OrderStatusConflictException;
import info.mouts.checkout.exception.OrderValidationException;
import info.mouts.checkout.exception.PaymentGatewayException;
import info.mouts.checkout.gateway.PaymentIntentResult;
import info.mouts.checkout.gateway.Refund;
import info.mouts.checkout.mapper.OrderMapper;
import info.mouts.checkout.service.CheckoutService;
import info.mouts.checkout.service.OrderService;
import info.mouts.checkout.service.PaymentIntentService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link CheckoutService} interface.
 * Orchestrates the cart, the order store and the payment intent adapter, and
 * enforces that only the owner of an order or an administrator can see or
 * change it.
 */
@Service
@Slf4j
public class CheckoutServiceImpl implements CheckoutService {
    private static final String CANCELLED_BY_USER = "Cancelled by user";
    private static final String CANCELLED_BY_ADMIN = "Cancelled by administrator";
    private static final int MAX_SUMMARY_DAYS = 365;

    private final CartClient cartClient;
    private final OrderService orderService;
    private final PaymentIntentService paymentIntentService;
    private final OrderMapper orderMapper;
    private final MeterRegistry meterRegistry;

    private Counter checkoutInitiatedCounter;
    private Counter checkoutFailedCounter;
    private Timer checkoutProcessingTimer;

    public CheckoutServiceImpl(CartClient cartClient, OrderService orderService,
            PaymentIntentService paymentIntentService, OrderMapper orderMapper, MeterRegistry meterRegistry) {
        this.cartClient = cartClient;
        this.orderService = orderService;
        this.paymentIntentService = paymentIntentService;
        this.orderMapper = orderMapper;
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Reads the cart, creates the order and opens its payment intent.
     *
     * @param userId The authenticated user.
     * @return The {@link CheckoutResponseDTO} with the client secret.
     * @throws OrderValidationException If the cart is empty or holds an
     *                                  unavailable product.
     * @throws PaymentGatewayException  If the processor call fails. The order is
     *                                  left {@code PENDING}.
     */
    @Override
    public CheckoutResponseDTO initiateCheckout(String userId) {
        return this.checkoutProcessingTimer.record(() -> {
            log.info("Initiating checkout for user {}", userId);
            checkoutInitiatedCounter.increment();

            try {
                List<CartItemDTO> cartItems = cartClient.getCart(userId);
                if (cartItems == null || cartItems.isEmpty()) {
                    log.warn("Checkout rejected for user {}: cart is empty", userId);
                    throw new OrderValidationException("Cart is empty.");
                }

                Order order = orderService.createOrder(userId, orderMapper.toOrderItemRequestDtoList(cartItems));

                try {
                    return toCheckoutResponse(paymentIntentService.createIntent(order));
                } catch (PaymentGatewayException e) {
                    log.error("Payment intent creation failed for order {}, order stays PENDING: {}",
                            order.getId(), e.getMessage());
                    throw e;
                }
            } catch (RuntimeException e) {
                checkoutFailedCounter.increment();
                throw e;
            }
        });
    }

    @Override
    public OrderStatus getOrderStatus(UUID orderId, Requester requester) {
        return getOrder(orderId, requester).getStatus();
    }

    /**
     * Returns the order when the requester owns it or is an administrator.
     *
     * @throws OrderAccessDeniedException If the requester may not see the order.
     */
    @Override
    public Order getOrder(UUID orderId, Requester requester) {
        Order order = orderService.findByOrderId(orderId);
        assertCanAccess(order, requester);
        return order;
    }

    @Override
    public Order getOrderByNumber(String orderNumber, Requester requester) {
        Order order = orderService.findByOrderNumber(orderNumber);
        assertCanAccess(order, requester);
        return order;
    }

    @Override
    public Page<Order> listOrdersForUser(String userId, Pageable pageable) {
        return orderService.findOrdersForUser(userId, pageable);
    }

    @Override
    public Page<Order> listAllOrders(Requester requester, Pageable pageable) {
        if (!requester.isAdmin()) {
            log.warn("User {} attempted to list all orders", requester.userId());
            throw new OrderAccessDeniedException("Only administrators can list all orders.");
        }
        return orderService.findAll(pageable);
    }

    /**
     * @throws OrderValidationException   If {@code days} is outside 1 to 365.
     * @throws OrderAccessDeniedException If the requester is not an
     *                                    administrator.
     */
    @Override
    public OrdersSummaryDTO getOrdersSummary(Requester requester, int days) {
        if (!requester.isAdmin()) {
            log.warn("User {} attempted to read the orders summary", requester.userId());
            throw new OrderAccessDeniedException("Only administrators can read the orders summary.");
        }
        if (days < 1 || days > MAX_SUMMARY_DAYS) {
            throw new OrderValidationException("Summary period must be between 1 and " + MAX_SUMMARY_DAYS
                    + " days.");
        }
        return orderService.summarizeOrders(days);
    }

    @Override
    public CheckoutResponseDTO retryPayment(UUID orderId, Requester requester) {
        Order order = getOrder(orderId, requester);

        if (order.getStatus() != OrderStatus.PENDING) {
            log.warn("Payment retry rejected for order {} in status {}", orderId, order.getStatus());
            throw new OrderStatusConflictException(orderId, OrderStatus.PENDING, order.getStatus());
        }

        log.info("Retrying payment intent creation for order {}", orderId);
        return toCheckoutResponse(paymentIntentService.createIntent(order));
    }

    @Override
    public Order cancelOrder(UUID orderId, Requester requester, String reason) {
        Order order = getOrder(orderId, requester);

        String cancellationReason = reason != null && !reason.isBlank() ? reason
                : requester.isAdmin() && !requester.owns(order) ? CANCELLED_BY_ADMIN : CANCELLED_BY_USER;

        log.info("Cancelling order {} on behalf of {}", orderId, requester.userId());
        return orderService.transitionStatus(orderId, OrderStatus.PENDING, OrderStatus.CANCELLED,
                cancellationReason);
    }

    /**
     * Refunds the order at the processor, then moves it to {@code REFUNDED}.
     * If the processor call fails the order stays {@code PAID}.
     *
     * @throws OrderAccessDeniedException   If the requester is not an
     *                                      administrator.
     * @throws OrderStatusConflictException If the order is not {@code PAID}.
     */
    @Override
    public Order refundOrder(UUID orderId, Requester requester) {
        if (!requester.isAdmin()) {
            log.warn("User {} attempted to refund order {}", requester.userId(), orderId);
            throw new OrderAccessDeniedException("Only administrators can refund orders.");
        }

        Order order = orderService.findByOrderId(orderId);
        if (order.getStatus() != OrderStatus.PAID) {
            throw new OrderStatusConflictException(orderId, OrderStatus.PAID, order.getStatus());
        }

        Refund refund = paymentIntentService.refund(order);
        log.info("Order {} refunded at the processor with refund {}", orderId, refund.getRefundId());

        return orderService.transitionStatus(orderId, OrderStatus.PAID, OrderStatus.REFUNDED);
    }

    private void assertCanAccess(Order order, Requester requester) {
        if (requester == null || !requester.canAccess(order)) {
            log.warn("Access to order {} denied for user {}", order.getId(),
                    requester == null ? null : requester.userId());
            throw new OrderAccessDeniedException(order.getId(), requester == null ? null : requester.userId());
        }
    }

    private CheckoutResponseDTO toCheckoutResponse(PaymentIntentResult result) {
        Order order = result.getOrder();

        return CheckoutResponseDTO.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .paymentIntentId(result.getPaymentIntent().getPaymentIntentId())
                .clientSecret(result.getPaymentIntent().getClientSecret())
                .totalAmount(order.getTotalAmount())
                .currency(order.getCurrency())
                .status(order.getStatus())
                .build();
    }

    /**
     * Initializes the Micrometer metrics for the checkout service.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.checkoutInitiatedCounter = Counter.builder("checkout.initiated")
                .description("Total number of checkout attempts")
                .register(registry);
        this.checkoutFailedCounter = Counter.builder("checkout.failed")
                .description("Total number of checkout attempts that did not return a payment intent")
                .register(registry);
        this.checkoutProcessingTimer = Timer.builder("checkout.processing.time")
                .description("Time taken from cart read to payment intent creation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }
}
