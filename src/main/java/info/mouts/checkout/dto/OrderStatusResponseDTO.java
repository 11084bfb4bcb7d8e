package info.mouts.checkout.dto;

import java.util.UUID;

import info.mouts.checkout.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Current status of an order")
public class OrderStatusResponseDTO {
    @Schema(description = "Order identifier", example = "a1b2c3d4-e5f6-7890-1234-567890abcdef")
    private UUID orderId;

    @Schema(description = "Current status", example = "PAID")
    private OrderStatus status;
}
