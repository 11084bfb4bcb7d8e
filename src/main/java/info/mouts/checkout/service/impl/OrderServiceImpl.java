package info.mouts.checkout.service.impl;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import info.mouts.checkout.client.CatalogClient;
import info.mouts.checkout.config.PaymentProperties;
import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderItem;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.dto.OrderItemRequestDTO;
import info.mouts.checkout.dto.OrdersSummaryDTO;
import info.mouts.checkout.dto.ProductDTO;
import info.mouts.checkout.event.OrderStatusChangedEvent;
import info.mouts.checkout.exception.InvalidStatusTransitionException;
import info.mouts.checkout.exception.OrderNotFoundException;
import info.mouts.checkout.exception.OrderStatusConflictException;
import info.mouts.checkout.exception.OrderValidationException;
import info.mouts.checkout.repository.OrderRepository;
import info.mouts.checkout.service.OrderService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link OrderService} interface.
 * <p>
 * Status changes are compare-and-swap updates executed by the database, so
 * concurrent callers expecting the same status get exactly one winner. The
 * losers receive an {@link OrderStatusConflictException} that does not mark
 * the surrounding transaction for rollback.
 */
@Service
@Slf4j
public class OrderServiceImpl implements OrderService {
    private static final DateTimeFormatter ORDER_NUMBER_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final int ORDER_NUMBER_ATTEMPTS = 3;

    private final OrderRepository orderRepository;
    private final CatalogClient catalogClient;
    private final PaymentProperties paymentProperties;
    private final TransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private Timer orderCreationTimer;
    private Counter statusConflictCounter;

    /**
     * Constructs an instance of {@code OrderServiceImpl}.
     *
     * @param orderRepository     The repository for order data access.
     * @param catalogClient       The catalog used to price new orders.
     * @param paymentProperties   The payment settings, for the order currency.
     * @param transactionTemplate Runs the persistence step of order creation in
     *                            its own transaction.
     * @param eventPublisher      The application event publisher for status
     *                            events.
     * @param meterRegistry       The registry for collecting metrics.
     */
    public OrderServiceImpl(OrderRepository orderRepository, CatalogClient catalogClient,
            PaymentProperties paymentProperties, TransactionTemplate transactionTemplate,
            ApplicationEventPublisher eventPublisher, MeterRegistry meterRegistry) {
        this.orderRepository = orderRepository;
        this.catalogClient = catalogClient;
        this.paymentProperties = paymentProperties;
        this.transactionTemplate = transactionTemplate;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    /**
     * Creates a new {@code PENDING} order.
     * The catalog is queried before any transaction is opened; only the insert
     * and the creation event run inside one.
     *
     * @param userId    The owner of the order.
     * @param lineItems The requested lines.
     * @return The persisted {@link Order}.
     * @throws OrderValidationException If there are no lines, a quantity is not
     *                                  positive, or a product is unknown or
     *                                  unavailable.
     */
    @Override
    public Order createOrder(String userId, List<OrderItemRequestDTO> lineItems) {
        return this.orderCreationTimer.record(() -> {
            if (userId == null || userId.isBlank()) {
                throw new OrderValidationException("User ID is required to create an order.");
            }
            if (lineItems == null || lineItems.isEmpty()) {
                log.warn("Rejecting order for user {} without items", userId);
                throw new OrderValidationException("Order must contain at least one item.");
            }

            List<OrderItem> items = new ArrayList<>();
            for (OrderItemRequestDTO line : lineItems) {
                items.add(priceLine(line));
            }

            BigDecimal totalAmount = calculateTotalAmount(items);

            Order order = Order.builder()
                    .orderNumber(generateOrderNumber())
                    .userId(userId)
                    .status(OrderStatus.PENDING)
                    .totalAmount(totalAmount)
                    .currency(paymentProperties.getCurrency())
                    .build();
            items.forEach(order::addItem);

            Order savedOrder = transactionTemplate.execute(status -> {
                Order saved = orderRepository.save(order);
                eventPublisher.publishEvent(new OrderStatusChangedEvent(this, saved, null));
                return saved;
            });

            log.info("Order {} ({}) created for user {} with {} items, total {} {}", savedOrder.getId(),
                    savedOrder.getOrderNumber(), userId, items.size(), totalAmount, savedOrder.getCurrency());

            return savedOrder;
        });
    }

    /**
     * Finds an order by its unique identifier (UUID).
     *
     * @param orderId The UUID of the order to find.
     * @return The {@link Order} entity if found.
     * @throws OrderNotFoundException If no order is found with the given ID.
     */
    @Override
    @Transactional(readOnly = true)
    public Order findByOrderId(UUID orderId) {
        log.debug("Attempting to find order by ID: {}", orderId);

        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found for ID: {}", orderId);
                    return new OrderNotFoundException(orderId);
                });
    }

    /**
     * Finds an order by its human-readable order number.
     *
     * @throws OrderNotFoundException If no order carries the number.
     */
    @Override
    @Transactional(readOnly = true)
    public Order findByOrderNumber(String orderNumber) {
        log.debug("Attempting to find order by number: {}", orderNumber);

        return orderRepository.findByOrderNumber(orderNumber)
                .orElseThrow(() -> {
                    log.warn("Order not found for number: {}", orderNumber);
                    return new OrderNotFoundException(orderNumber);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findByPaymentIntentId(String paymentIntentId) {
        return orderRepository.findByPaymentIntentId(paymentIntentId);
    }

    @Override
    @Transactional(noRollbackFor = OrderStatusConflictException.class)
    public Order transitionStatus(UUID orderId, OrderStatus from, OrderStatus to) {
        return transitionStatus(orderId, from, to, null);
    }

    /**
     * Applies the transition with a single conditional update.
     *
     * @throws InvalidStatusTransitionException If {@code from -> to} is not an
     *                                          edge of the status graph.
     * @throws OrderStatusConflictException     If the order no longer holds
     *                                          {@code from}.
     * @throws OrderNotFoundException           If the order does not exist.
     */
    @Override
    @Transactional(noRollbackFor = OrderStatusConflictException.class)
    public Order transitionStatus(UUID orderId, OrderStatus from, OrderStatus to, String reason) {
        if (from == null || !from.canTransitionTo(to)) {
            throw new InvalidStatusTransitionException(from, to);
        }

        LocalDateTime now = LocalDateTime.now();
        int updated = reason == null
                ? orderRepository.compareAndSetStatus(orderId, from, to, now)
                : orderRepository.compareAndSetStatusWithReason(orderId, from, to, reason, now);

        if (updated == 0) {
            throw conflict(orderId, from);
        }

        Order order = findByOrderId(orderId);
        log.info("Order {} moved from {} to {}", orderId, from, to);

        eventPublisher.publishEvent(new OrderStatusChangedEvent(this, order, from));
        return order;
    }

    /**
     * Assigns the payment intent, moving the order to
     * {@code PAYMENT_PROCESSING}.
     *
     * @throws OrderStatusConflictException If the order is no longer
     *                                      {@code PENDING} or already holds an
     *                                      intent.
     * @throws OrderNotFoundException       If the order does not exist.
     */
    @Override
    @Transactional(noRollbackFor = OrderStatusConflictException.class)
    public Order assignPaymentIntent(UUID orderId, String paymentIntentId) {
        int updated = orderRepository.assignPaymentIntent(orderId, paymentIntentId, LocalDateTime.now());

        if (updated == 0) {
            throw conflict(orderId, OrderStatus.PENDING);
        }

        Order order = findByOrderId(orderId);
        log.info("Payment intent {} assigned to order {}, status is now {}", paymentIntentId, orderId,
                order.getStatus());

        eventPublisher.publishEvent(new OrderStatusChangedEvent(this, order, OrderStatus.PENDING));
        return order;
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Order> findOrdersForUser(String userId, Pageable pageable) {
        log.debug("Attempting to find orders of user {} with pagination: {}", userId, pageable);

        return orderRepository.findByUserId(userId, newestFirst(pageable));
    }

    /**
     * Retrieves a paginated list of all orders from the database.
     *
     * @param pageable The pagination information (page number, size, sort).
     * @return A {@link Page} containing the {@link Order} entities for the
     *         requested page.
     */
    @Override
    @Transactional(readOnly = true)
    public Page<Order> findAll(Pageable pageable) {
        log.debug("Attempting to find all orders with pagination: {}", pageable);

        return orderRepository.findAll(newestFirst(pageable));
    }

    @Override
    @Transactional(readOnly = true)
    public OrdersSummaryDTO summarizeOrders(int days) {
        LocalDateTime since = LocalDateTime.now().minusDays(days);

        Map<OrderStatus, Long> byStatus = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (OrderRepository.StatusCount count : orderRepository.countByStatusSince(since)) {
            byStatus.put(count.getStatus(), count.getTotal());
        }

        BigDecimal revenue = orderRepository.sumTotalAmountByStatusSince(OrderStatus.PAID, since);

        OrdersSummaryDTO summary = OrdersSummaryDTO.builder()
                .totalOrders(orderRepository.countByCreatedAtGreaterThanEqual(since))
                .totalRevenue(revenue == null ? BigDecimal.ZERO : revenue)
                .ordersByStatus(byStatus)
                .periodDays(days)
                .build();

        log.debug("Summarized {} orders created since {}", summary.getTotalOrders(), since);
        return summary;
    }

    private OrderItem priceLine(OrderItemRequestDTO line) {
        if (line == null || line.getProductId() == null || line.getProductId().isBlank()) {
            throw new OrderValidationException("Every item must reference a product.");
        }
        if (line.getQuantity() == null || line.getQuantity() <= 0) {
            throw new OrderValidationException(
                    "Quantity for product " + line.getProductId() + " must be greater than zero.");
        }

        ProductDTO product = catalogClient.getProduct(line.getProductId())
                .filter(ProductDTO::isPurchasable)
                .orElseThrow(() -> {
                    log.warn("Product {} is unknown or unavailable", line.getProductId());
                    return new OrderValidationException(
                            "Product " + line.getProductId() + " is unknown or unavailable.");
                });

        return OrderItem.builder()
                .productId(line.getProductId())
                .productName(product.getName())
                .quantity(line.getQuantity())
                .unitPrice(product.getPrice().setScale(2, RoundingMode.HALF_UP))
                .build();
    }

    /**
     * Sums quantity times unit price over all lines.
     *
     * @param items The priced lines.
     * @return The total with two decimals.
     */
    private BigDecimal calculateTotalAmount(List<OrderItem> items) {
        return items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private String generateOrderNumber() {
        String orderNumber = null;
        for (int attempt = 0; attempt < ORDER_NUMBER_ATTEMPTS; attempt++) {
            orderNumber = "ORD-" + LocalDate.now().format(ORDER_NUMBER_DATE) + "-"
                    + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
            if (!orderRepository.existsByOrderNumber(orderNumber)) {
                return orderNumber;
            }
        }
        return orderNumber;
    }

    private OrderStatusConflictException conflict(UUID orderId, OrderStatus expected) {
        Order current = findByOrderId(orderId);
        statusConflictCounter.increment();
        log.warn("Order {} was expected in status {} but is {}", orderId, expected, current.getStatus());

        return new OrderStatusConflictException(orderId, expected, current.getStatus());
    }

    private Pageable newestFirst(Pageable pageable) {
        if (pageable.isPaged() && pageable.getSort().isUnsorted()) {
            return PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                    Sort.by(Sort.Direction.DESC, "createdAt"));
        }
        return pageable;
    }

    /**
     * Initializes the Micrometer metrics for the order service.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.orderCreationTimer = Timer.builder("orders.creation.time")
                .description("Time taken to price and persist a new order")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.statusConflictCounter = Counter.builder("orders.status.conflicts")
                .description("Status transitions lost to a concurrent change")
                .register(registry);
    }
}
