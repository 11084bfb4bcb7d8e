package info.mouts.checkout.client;

import java.util.Optional;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import info.mouts.checkout.config.HttpClientConfig;
import info.mouts.checkout.dto.ProductDTO;
import info.mouts.checkout.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;

@Component
@Slf4j
public class RestCatalogClient implements CatalogClient {
    private final RestClient restClient;

    public RestCatalogClient(@Qualifier(HttpClientConfig.CATALOG_CLIENT) RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<ProductDTO> getProduct(String productId) {
        try {
            ProductDTO product = restClient.get()
                    .uri("/api/v1/products/{productId}", productId)
                    .retrieve()
                    .body(ProductDTO.class);

            return Optional.ofNullable(product);
        } catch (HttpClientErrorException.NotFound e) {
            log.info("Product {} not found in catalog", productId);
            return Optional.empty();
        } catch (HttpClientErrorException e) {
            throw new CollaboratorUnavailableException("Catalog rejected request for product " + productId, e);
        } catch (RestClientException e) {
            log.error("Catalog unavailable while fetching product {}: {}", productId, e.getMessage());
            throw new CollaboratorUnavailableException("Catalog service unavailable", e);
        }
    }
}
