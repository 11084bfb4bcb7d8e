package info.mouts.checkout.client;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import info.mouts.checkout.config.HttpClientConfig;
import info.mouts.checkout.dto.CartItemDTO;
import info.mouts.checkout.dto.CartResponseDTO;
import info.mouts.checkout.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;

@Component
@Slf4j
public class RestCartClient implements CartClient {
    private final RestClient restClient;

    public RestCartClient(@Qualifier(HttpClientConfig.CART_CLIENT) RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<CartItemDTO> getCart(String userId) {
        log.debug("Fetching cart for user {}", userId);

        try {
            CartResponseDTO cart = restClient.get()
                    .uri("/api/v1/carts/{userId}", userId)
                    .retrieve()
                    .body(CartResponseDTO.class);

            if (cart == null || cart.getItems() == null) {
                return List.of();
            }
            return cart.getItems();
        } catch (HttpClientErrorException.NotFound e) {
            log.info("No cart found for user {}", userId);
            return List.of();
        } catch (HttpClientErrorException e) {
            throw new CollaboratorUnavailableException("Cart service rejected request for user " + userId, e);
        } catch (RestClientException e) {
            log.error("Cart service unavailable for user {}: {}", userId, e.getMessage());
            throw new CollaboratorUnavailableException("Cart service unavailable", e);
        }
    }
}
