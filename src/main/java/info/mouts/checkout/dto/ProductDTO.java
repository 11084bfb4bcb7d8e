package info.mouts.checkout.dto;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Product as returned by the catalog service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductDTO {
    private String productId;
    private String name;
    private BigDecimal price;
    private Boolean available;

    public boolean isPurchasable() {
        return Boolean.TRUE.equals(available) && price != null && price.signum() >= 0;
    }
}
