package info.mouts.checkout.dto;

import java.math.BigDecimal;
import java.util.UUID;

import info.mouts.checkout.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Order created from the cart together with the payment intent the client must confirm")
public class CheckoutResponseDTO {
    @Schema(description = "Order identifier", example = "a1b2c3d4-e5f6-7890-1234-567890abcdef")
    private UUID orderId;

    @Schema(description = "Human readable order number", example = "ORD-20240101-1A2B3C4D")
    private String orderNumber;

    @Schema(description = "Payment intent opened at the processor", example = "pi_3N1a2b3c4d")
    private String paymentIntentId;

    @Schema(description = "Client secret used by the front end to confirm the payment", example = "pi_3N1a2b3c4d_secret_xyz")
    private String clientSecret;

    @Schema(description = "Total amount to pay", example = "20.00")
    private BigDecimal totalAmount;

    @Schema(description = "ISO currency code", example = "usd")
    private String currency;

    @Schema(description = "Status of the order after checkout", example = "PAYMENT_PROCESSING")
    private OrderStatus status;
}
