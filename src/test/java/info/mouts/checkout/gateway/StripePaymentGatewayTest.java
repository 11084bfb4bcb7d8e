package info.mouts.checkout.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import info.mouts.checkout.config.PaymentProperties;
import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.exception.PaymentGatewayException;

public class StripePaymentGatewayTest {
    private static final String BASE_URL = "https://processor.test";

    private MockRestServiceServer server;
    private StripePaymentGateway gateway;
    private Order order;

    @BeforeEach
    void setUp() {
        PaymentProperties properties = new PaymentProperties();
        properties.setSecretKey("sk_test_123");

        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new StripePaymentGateway(builder.build(), properties);

        order = Order.builder()
                .id(UUID.fromString("a1b2c3d4-e5f6-7890-1234-567890abcdef"))
                .orderNumber("ORD-20250101-ABCDEF12")
                .userId("user-1")
                .status(OrderStatus.PENDING)
                .totalAmount(new BigDecimal("19.99"))
                .currency("usd")
                .build();
    }

    @Test
    @DisplayName("Should post the amount in cents with the order metadata")
    void createIntent_postsFormAndParsesIntent() {
        MultiValueMap<String, String> expectedForm = new LinkedMultiValueMap<>();
        expectedForm.add("amount", "1999");
        expectedForm.add("currency", "usd");
        expectedForm.add("automatic_payment_methods[enabled]", "true");
        expectedForm.add("metadata[order_id]", "a1b2c3d4-e5f6-7890-1234-567890abcdef");
        expectedForm.add("metadata[order_number]", "ORD-20250101-ABCDEF12");
        expectedForm.add("metadata[user_id]", "user-1");

        server.expect(requestTo(BASE_URL + "/v1/payment_intents"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk_test_123"))
                .andExpect(content().formData(expectedForm))
                .andRespond(withSuccess("{\"id\":\"pi_1\",\"client_secret\":\"pi_1_secret_x\",\"amount\":1999,"
                        + "\"currency\":\"usd\",\"status\":\"requires_payment_method\"}", MediaType.APPLICATION_JSON));

        PaymentIntent intent = gateway.createIntent(order);

        assertThat(intent.getPaymentIntentId()).isEqualTo("pi_1");
        assertThat(intent.getClientSecret()).isEqualTo("pi_1_secret_x");
        assertThat(intent.getAmount()).isEqualByComparingTo("19.99");
        server.verify();
    }

    @Test
    @DisplayName("Should wrap a 4xx answer in PaymentGatewayException")
    void createIntent_clientError_throwsGatewayException() {
        server.expect(requestTo(BASE_URL + "/v1/payment_intents"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        PaymentGatewayException ex = assertThrows(PaymentGatewayException.class,
                () -> gateway.createIntent(order));

        assertThat(ex.getMessage()).contains("401");
    }

    @Test
    void createIntent_serverError_throwsGatewayException() {
        server.expect(requestTo(BASE_URL + "/v1/payment_intents")).andRespond(withServerError());

        assertThrows(PaymentGatewayException.class, () -> gateway.createIntent(order));
    }

    @Test
    void createIntent_timeout_throwsGatewayException() {
        server.expect(requestTo(BASE_URL + "/v1/payment_intents"))
                .andRespond(withException(new SocketTimeoutException("Read timed out")));

        assertThrows(PaymentGatewayException.class, () -> gateway.createIntent(order));
    }

    @Test
    @DisplayName("Should reject an intent without client secret")
    void createIntent_incompleteResponse_throwsGatewayException() {
        server.expect(requestTo(BASE_URL + "/v1/payment_intents"))
                .andRespond(withSuccess("{\"id\":\"pi_1\"}", MediaType.APPLICATION_JSON));

        assertThrows(PaymentGatewayException.class, () -> gateway.createIntent(order));
    }

    @Test
    void cancelIntent_postsToCancelEndpoint() {
        server.expect(requestTo(BASE_URL + "/v1/payment_intents/pi_1/cancel"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess("{\"id\":\"pi_1\",\"status\":\"canceled\"}", MediaType.APPLICATION_JSON));

        gateway.cancelIntent("pi_1");

        server.verify();
    }

    @Test
    void createRefund_postsIntentAndAmount() {
        MultiValueMap<String, String> expectedForm = new LinkedMultiValueMap<>();
        expectedForm.add("payment_intent", "pi_1");
        expectedForm.add("amount", "2000");

        server.expect(requestTo(BASE_URL + "/v1/refunds"))
                .andExpect(content().formData(expectedForm))
                .andRespond(withSuccess("{\"id\":\"re_1\",\"amount\":2000,\"status\":\"succeeded\","
                        + "\"payment_intent\":\"pi_1\"}", MediaType.APPLICATION_JSON));

        Refund refund = gateway.createRefund("pi_1", new BigDecimal("20.00"));

        assertThat(refund.getRefundId()).isEqualTo("re_1");
        assertThat(refund.getAmount()).isEqualByComparingTo("20.00");
        assertThat(refund.getStatus()).isEqualTo("succeeded");
    }

    @Test
    @DisplayName("Should round amounts to whole cents")
    void toMinorUnits_roundsHalfUp() {
        assertThat(PaymentGateway.toMinorUnits(new BigDecimal("10"))).isEqualTo(1000L);
        assertThat(PaymentGateway.toMinorUnits(new BigDecimal("0.005"))).isEqualTo(1L);
        assertThat(PaymentGateway.fromMinorUnits(1999L)).isEqualByComparingTo("19.99");
        assertThat(PaymentGateway.fromMinorUnits(null)).isNull();
    }
}
