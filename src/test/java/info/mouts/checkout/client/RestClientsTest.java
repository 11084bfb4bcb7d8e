package info.mouts.checkout.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.net.ConnectException;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import info.mouts.checkout.dto.CartItemDTO;
import info.mouts.checkout.dto.ProductDTO;
import info.mouts.checkout.exception.CollaboratorUnavailableException;

public class RestClientsTest {
    private static final String BASE_URL = "http://collaborator.test";

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    @Nested
    @DisplayName("RestCartClient")
    class CartTests {

        @Test
        void getCart_returnsItems() {
            server.expect(requestTo(BASE_URL + "/api/v1/carts/user-1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("{\"userId\":\"user-1\",\"items\":[{\"productId\":\"p1\",\"quantity\":2}]}",
                            MediaType.APPLICATION_JSON));

            List<CartItemDTO> items = new RestCartClient(restClient).getCart("user-1");

            assertThat(items).hasSize(1);
            assertThat(items.get(0).getProductId()).isEqualTo("p1");
            assertThat(items.get(0).getQuantity()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should treat a missing cart as empty")
        void getCart_notFound_returnsEmpty() {
            server.expect(requestTo(BASE_URL + "/api/v1/carts/user-1")).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThat(new RestCartClient(restClient).getCart("user-1")).isEmpty();
        }

        @Test
        void getCart_serverError_throwsUnavailable() {
            server.expect(requestTo(BASE_URL + "/api/v1/carts/user-1")).andRespond(withServerError());

            assertThrows(CollaboratorUnavailableException.class,
                    () -> new RestCartClient(restClient).getCart("user-1"));
        }
    }

    @Nested
    @DisplayName("RestCatalogClient")
    class CatalogTests {

        @Test
        void getProduct_returnsProduct() {
            server.expect(requestTo(BASE_URL + "/api/v1/products/p1"))
                    .andRespond(withSuccess("{\"productId\":\"p1\",\"name\":\"Mug\",\"price\":10.00,\"available\":true}",
                            MediaType.APPLICATION_JSON));

            Optional<ProductDTO> product = new RestCatalogClient(restClient).getProduct("p1");

            assertThat(product).isPresent();
            assertThat(product.get().getPrice()).isEqualByComparingTo("10.00");
            assertThat(product.get().isPurchasable()).isTrue();
        }

        @Test
        void getProduct_notFound_returnsEmpty() {
            server.expect(requestTo(BASE_URL + "/api/v1/products/ghost")).andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThat(new RestCatalogClient(restClient).getProduct("ghost")).isEmpty();
        }

        @Test
        void getProduct_connectionRefused_throwsUnavailable() {
            server.expect(requestTo(BASE_URL + "/api/v1/products/p1"))
                    .andRespond(withException(new ConnectException("Connection refused")));

            assertThrows(CollaboratorUnavailableException.class,
                    () -> new RestCatalogClient(restClient).getProduct("p1"));
        }
    }
}
