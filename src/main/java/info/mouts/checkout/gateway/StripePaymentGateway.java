package info.mouts.checkout.gateway;

import java.math.BigDecimal;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import info.mouts.checkout.config.HttpClientConfig;
import info.mouts.checkout.config.PaymentProperties;
import info.mouts.checkout.domain.Order;
import info.mouts.checkout.dto.StripePaymentIntentResponseDTO;
import info.mouts.checkout.dto.StripeRefundResponseDTO;
import info.mouts.checkout.exception.PaymentGatewayException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link PaymentGateway} backed by the processor's REST API. Requests are form
 * encoded and authenticated with the secret key as a bearer token.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.payment.mode", havingValue = "stripe", matchIfMissing = true)
public class StripePaymentGateway implements PaymentGateway {
    static final String PAYMENT_INTENTS_PATH = "/v1/payment_intents";
    static final String REFUNDS_PATH = "/v1/refunds";

    private final RestClient restClient;
    private final PaymentProperties properties;

    public StripePaymentGateway(@Qualifier(HttpClientConfig.PAYMENT_CLIENT) RestClient restClient,
            PaymentProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public PaymentIntent createIntent(Order order) {
        long amountInCents = PaymentGateway.toMinorUnits(order.getTotalAmount());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("amount", Long.toString(amountInCents));
        form.add("currency", order.getCurrency());
        form.add("automatic_payment_methods[enabled]", "true");
        form.add("metadata[order_id]", order.getId().toString());
        form.add("metadata[order_number]", order.getOrderNumber());
        form.add("metadata[user_id]", order.getUserId());

        log.info("Creating payment intent for order {} ({} {} in minor units)", order.getId(), amountInCents,
                order.getCurrency());

        StripePaymentIntentResponseDTO response = post(PAYMENT_INTENTS_PATH, form,
                StripePaymentIntentResponseDTO.class, "create payment intent for order " + order.getId());

        if (response == null || response.getId() == null || response.getClientSecret() == null) {
            throw new PaymentGatewayException("Processor returned an incomplete payment intent for order "
                    + order.getId());
        }

        log.info("Payment intent {} created for order {}", response.getId(), order.getId());

        return PaymentIntent.builder()
                .paymentIntentId(response.getId())
                .clientSecret(response.getClientSecret())
                .amount(PaymentGateway.fromMinorUnits(response.getAmount()))
                .currency(response.getCurrency())
                .status(response.getStatus())
                .build();
    }

    @Override
    public void cancelIntent(String paymentIntentId) {
        log.info("Cancelling payment intent {}", paymentIntentId);

        post(PAYMENT_INTENTS_PATH + "/" + paymentIntentId + "/cancel", new LinkedMultiValueMap<>(),
                StripePaymentIntentResponseDTO.class, "cancel payment intent " + paymentIntentId);
    }

    @Override
    public Refund createRefund(String paymentIntentId, BigDecimal amount) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("payment_intent", paymentIntentId);
        if (amount != null) {
            form.add("amount", Long.toString(PaymentGateway.toMinorUnits(amount)));
        }

        log.info("Creating refund for payment intent {}", paymentIntentId);

        StripeRefundResponseDTO response = post(REFUNDS_PATH, form, StripeRefundResponseDTO.class,
                "refund payment intent " + paymentIntentId);

        if (response == null || response.getId() == null) {
            throw new PaymentGatewayException("Processor returned an incomplete refund for " + paymentIntentId);
        }

        return Refund.builder()
                .refundId(response.getId())
                .paymentIntentId(paymentIntentId)
                .amount(PaymentGateway.fromMinorUnits(response.getAmount()))
                .status(response.getStatus())
                .build();
    }

    private <T> T post(String path, MultiValueMap<String, String> form, Class<T> responseType, String action) {
        try {
            return restClient.post()
                    .uri(path)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getSecretKey())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(responseType);
        } catch (RestClientResponseException e) {
            log.error("Processor rejected request to {}: HTTP {}", action, e.getStatusCode().value());
            throw new PaymentGatewayException("Payment processor rejected request to " + action
                    + " with HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.error("Processor unreachable while trying to {}: {}", action, e.getMessage());
            throw new PaymentGatewayException("Payment processor unavailable while trying to " + action, e);
        }
    }
}
