package info.mouts.checkout.client;

import java.util.Optional;

import info.mouts.checkout.dto.ProductDTO;
import info.mouts.checkout.exception.CollaboratorUnavailableException;

/**
 * Read access to the product catalog.
 */
public interface CatalogClient {
    /**
     * Looks up a product.
     *
     * @param productId The product identifier.
     * @return The product, or empty when the catalog does not know it.
     * @throws CollaboratorUnavailableException If the catalog cannot answer.
     */
    Optional<ProductDTO> getProduct(String productId);
}
