package info.mouts.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A requested order line. Carries no price: prices are read from the catalog
 * when the order is created, which also rejects a blank product id or a
 * quantity below one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemRequestDTO {
    private String productId;
    private Integer quantity;
}
