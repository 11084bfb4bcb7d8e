package info.mouts.checkout.gateway;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import info.mouts.checkout.domain.Order;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link PaymentGateway} that fabricates intents locally, for environments
 * without processor credentials. Payments are confirmed by posting a signed
 * webhook for the returned intent id.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "app.payment.mode", havingValue = "demo")
public class DemoPaymentGateway implements PaymentGateway {
    static final String INTENT_PREFIX = "pi_demo_";
    static final String SECRET_SUFFIX = "_secret_demo";

    private final SecureRandom random = new SecureRandom();

    @Override
    public PaymentIntent createIntent(Order order) {
        String paymentIntentId = INTENT_PREFIX + randomHex();

        log.info("Demo mode: created payment intent {} for order {}", paymentIntentId, order.getId());

        return PaymentIntent.builder()
                .paymentIntentId(paymentIntentId)
                .clientSecret(paymentIntentId + SECRET_SUFFIX)
                .amount(order.getTotalAmount())
                .currency(order.getCurrency())
                .status("requires_payment_method")
                .build();
    }

    @Override
    public void cancelIntent(String paymentIntentId) {
        log.info("Demo mode: cancelled payment intent {}", paymentIntentId);
    }

    @Override
    public Refund createRefund(String paymentIntentId, BigDecimal amount) {
        log.info("Demo mode: refunded payment intent {}", paymentIntentId);

        return Refund.builder()
                .refundId("re_demo_" + randomHex())
                .paymentIntentId(paymentIntentId)
                .amount(amount)
                .status("succeeded")
                .build();
    }

    private String randomHex() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
