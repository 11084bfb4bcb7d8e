package info.mouts.checkout.dto;

import java.math.BigDecimal;
import java.util.Map;

import info.mouts.checkout.domain.OrderStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Order activity over a recent period")
public class OrdersSummaryDTO {
    @Schema(description = "Orders created in the period", example = "42")
    private long totalOrders;

    @Schema(description = "Sum of the totals of the paid orders created in the period", example = "1234.50")
    private BigDecimal totalRevenue;

    @Schema(description = "Orders created in the period per status; every status is listed")
    private Map<OrderStatus, Long> ordersByStatus;

    @Schema(description = "Length of the period in days", example = "30")
    private int periodDays;
}
