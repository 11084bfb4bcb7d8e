package info.mouts.checkout.event;

import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import info.mouts.checkout.dto.OrderStatusChangedEventDTO;
import info.mouts.checkout.mapper.OrderMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Event listener component that handles {@link OrderStatusChangedEvent}.
 * This listener is triggered only after the transaction that changed the order
 * is committed, so a rolled back transition is never announced.
 * It converts the order into an {@link OrderStatusChangedEventDTO} and
 * publishes it to a Kafka topic keyed by order id.
 */
@Component
@Slf4j
public class OrderStatusChangedEventListener {
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final OrderMapper orderMapper;
    private final String orderStatusTopic;

    public OrderStatusChangedEventListener(KafkaTemplate<String, Object> kafkaTemplate, OrderMapper orderMapper,
            @Value("${app.kafka.order-status-topic}") String orderStatusTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.orderMapper = orderMapper;
        this.orderStatusTopic = orderStatusTopic;
    }

    /**
     * Sends the status change to {@code app.kafka.order-status-topic}
     * asynchronously. Publish failures are logged and never affect the committed
     * transition.
     *
     * @param event The {@link OrderStatusChangedEvent} carrying the order.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onOrderStatusChanged(OrderStatusChangedEvent event) {
        OrderStatusChangedEventDTO payload = orderMapper.toStatusChangedEventDto(event.getOrder(),
                event.getPreviousStatus());

        String orderId = payload.getOrderId().toString();
        log.info("Publishing status change {} -> {} for Order ID {}", payload.getPreviousStatus(),
                payload.getStatus(), orderId);

        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(orderStatusTopic, orderId,
                    payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.info("Successfully published status change to topic {} for Order ID {}", orderStatusTopic,
                            orderId);
                } else {
                    log.error("Failed to publish status change to topic {} for Order ID {}: {}", orderStatusTopic,
                            orderId, ex.getMessage(), ex);
                }
            });
        } catch (Exception e) {
            log.error("Exception while sending status change to topic {} for Order ID {}: {}", orderStatusTopic,
                    orderId, e.getMessage(), e);
        }
    }

}
