package info.mouts.checkout.service.impl;

import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.PaymentOutcome;
import info.mouts.checkout.domain.ProcessedPaymentEvent;
import info.mouts.checkout.domain.WebhookOutcome;
import info.mouts.checkout.dto.PaymentWebhookEventDTO;
import info.mouts.checkout.dto.WebhookResultDTO;
import info.mouts.checkout.exception.OrderStatusConflictException;
import info.mouts.checkout.repository.ProcessedPaymentEventRepository;
import info.mouts.checkout.service.OrderService;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies a verified processor event to its order and records the event id,
 * both in one transaction. A second delivery of the same event id either finds
 * the record or fails on its primary key, in which case the whole transaction
 * rolls back.
 */
@Component
@Slf4j
public class PaymentEventProcessor {
    private static final String UNKNOWN_EVENT_TYPE = "unknown";
    private static final int MAX_FAILURE_REASON_LENGTH = 500;

    private final OrderService orderService;
    private final ProcessedPaymentEventRepository processedEventRepository;

    public PaymentEventProcessor(OrderService orderService,
            ProcessedPaymentEventRepository processedEventRepository) {
        this.orderService = orderService;
        this.processedEventRepository = processedEventRepository;
    }

    /**
     * Interprets the event and moves the order holding its payment intent.
     *
     * @param event A parsed event with a non-blank event id.
     * @return The outcome of the event.
     * @throws DataIntegrityViolationException If a concurrent delivery recorded
     *                                         the same event id first.
     */
    @Transactional
    public WebhookResultDTO process(PaymentWebhookEventDTO event) {
        String eventId = event.getEventId();

        if (processedEventRepository.existsById(eventId)) {
            log.info("Event {} was already processed, skipping", eventId);
            return WebhookResultDTO.of(eventId, WebhookOutcome.DUPLICATE);
        }

        PaymentOutcome outcome = PaymentOutcome.fromEventType(event.getType());
        String paymentIntentId = event.paymentIntentId();

        if (outcome == PaymentOutcome.UNKNOWN) {
            log.info("Ignoring event {} of unhandled type {}", eventId, event.getType());
            return record(event, null, WebhookOutcome.IGNORED);
        }

        if (paymentIntentId == null || paymentIntentId.isBlank()) {
            log.error("Event {} of type {} carries no payment intent id", eventId, event.getType());
            return record(event, null, WebhookOutcome.IGNORED);
        }

        Optional<Order> order = orderService.findByPaymentIntentId(paymentIntentId);
        if (order.isEmpty()) {
            log.error("Event {} references payment intent {} which belongs to no order", eventId,
                    paymentIntentId);
            return record(event, null, WebhookOutcome.ORDER_NOT_FOUND);
        }

        UUID orderId = order.get().getId();
        OrderStatus target = outcome.targetStatus();

        try {
            Order updated = outcome == PaymentOutcome.PAYMENT_SUCCEEDED
                    ? orderService.transitionStatus(orderId, OrderStatus.PAYMENT_PROCESSING, OrderStatus.PAID)
                    : orderService.transitionStatus(orderId, OrderStatus.PAYMENT_PROCESSING, OrderStatus.FAILED,
                            failureReason(event));

            log.info("Event {} applied: order {} is now {}", eventId, orderId, updated.getStatus());
            return record(event, updated, WebhookOutcome.APPLIED);
        } catch (OrderStatusConflictException e) {
            if (e.getActualStatus() == target) {
                log.info("Event {} found order {} already {}", eventId, orderId, target);
                return record(event, orderId, target, WebhookOutcome.ALREADY_APPLIED);
            }

            log.warn("Stale event {} of type {}: order {} is {} and cannot move to {}", eventId, event.getType(),
                    orderId, e.getActualStatus(), target);
            return record(event, orderId, e.getActualStatus(), WebhookOutcome.STALE);
        }
    }

    private WebhookResultDTO record(PaymentWebhookEventDTO event, Order order, WebhookOutcome outcome) {
        return order == null
                ? record(event, null, null, outcome)
                : record(event, order.getId(), order.getStatus(), outcome);
    }

    private WebhookResultDTO record(PaymentWebhookEventDTO event, UUID orderId, OrderStatus orderStatus,
            WebhookOutcome outcome) {
        String observedStatus = truncate(event.getData() == null ? null : event.getData().getStatus(),
                ProcessedPaymentEvent.MAX_TEXT_LENGTH);

        String eventType = event.getType() == null ? UNKNOWN_EVENT_TYPE : event.getType();

        processedEventRepository.saveAndFlush(new ProcessedPaymentEvent(event.getEventId(), eventType,
                event.paymentIntentId(), orderId, observedStatus, outcome));

        return WebhookResultDTO.builder()
                .eventId(event.getEventId())
                .outcome(outcome)
                .orderId(orderId)
                .orderStatus(orderStatus)
                .build();
    }

    private String failureReason(PaymentWebhookEventDTO event) {
        if (event.getData() != null && event.getData().getFailureReason() != null
                && !event.getData().getFailureReason().isBlank()) {
            return truncate(event.getData().getFailureReason(), MAX_FAILURE_REASON_LENGTH);
        }
        return event.getType() != null && event.getType().endsWith("canceled")
                ? "Payment canceled"
                : "Payment failed";
    }

    private static String truncate(String value, int maxLength) {
        return value != null && value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
