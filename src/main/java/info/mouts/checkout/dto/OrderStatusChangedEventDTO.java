package info.mouts.checkout.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonFormat;

import info.mouts.checkout.domain.OrderStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Kafka payload published after every committed status change.
 * {@code previousStatus} is {@code null} for a newly created order.
 */
@Data
@NoArgsConstructor
public class OrderStatusChangedEventDTO {
    private UUID orderId;
    private String orderNumber;
    private String userId;
    private OrderStatus previousStatus;
    private OrderStatus status;
    private BigDecimal totalAmount;
    private String currency;
    private String paymentIntentId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private LocalDateTime changedAt;
}
