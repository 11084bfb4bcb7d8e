package info.mouts.checkout.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

import info.mouts.checkout.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode(callSuper = false)
@Relation(collectionRelation = "orders", itemRelation = "order")
@Schema(description = "Detailed information about an order and its payment status")
public class OrderResponseDTO extends RepresentationModel<OrderResponseDTO> {
    @Schema(description = "Internal unique identifier of the order (UUID)", example = "a1b2c3d4-e5f6-7890-1234-567890abcdef")
    private UUID id;

    @Schema(description = "Human readable order number", example = "ORD-20240101-1A2B3C4D")
    private String orderNumber;

    @Schema(description = "Identifier of the user who owns the order", example = "user-42")
    private String userId;

    @Schema(description = "Current status of the order", example = "PAYMENT_PROCESSING")
    private OrderStatus status;

    @Schema(description = "Total amount of the order, computed from the snapshotted prices", example = "20.00")
    private BigDecimal totalAmount;

    @Schema(description = "ISO currency code", example = "usd")
    private String currency;

    @Schema(description = "Payment intent opened at the processor", example = "pi_3N1a2b3c4d")
    private String paymentIntentId;

    @Schema(description = "Reason reported for a failed or cancelled order", example = "Your card was declined.")
    private String failureReason;

    @Schema(description = "Timestamp when the order was created", example = "2024-01-01T12:00:00")
    private LocalDateTime createdAt;

    @Schema(description = "Timestamp of the last status change", example = "2024-01-01T12:01:00")
    private LocalDateTime updatedAt;
}
