package info.mouts.checkout.dto;

import java.math.BigDecimal;
import java.util.UUID;

import org.springframework.hateoas.RepresentationModel;
import org.springframework.hateoas.server.core.Relation;

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
@Relation(collectionRelation = "items", itemRelation = "item")
@Schema(description = "A line of an order")
public class OrderItemResponseDTO extends RepresentationModel<OrderItemResponseDTO> {
    @Schema(description = "Internal unique identifier of the item (UUID)", example = "b1c2d3e4-f5a6-7890-1234-567890abcdef")
    private UUID id;

    @Schema(description = "Product identifier", example = "p1")
    private String productId;

    @Schema(description = "Product name at the time of purchase", example = "Coffee mug")
    private String productName;

    @Schema(description = "Quantity of the product", example = "2")
    private Integer quantity;

    @Schema(description = "Unit price at the time of purchase", example = "10.00")
    private BigDecimal unitPrice;

    @Schema(description = "Quantity times unit price", example = "20.00")
    private BigDecimal lineTotal;
}
