package info.mouts.checkout.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import info.mouts.checkout.domain.Order;

public class DemoPaymentGatewayTest {
    private final DemoPaymentGateway gateway = new DemoPaymentGateway();

    @Test
    void createIntent_fabricatesUniqueIntents() {
        Order order = Order.builder()
                .id(UUID.randomUUID())
                .totalAmount(new BigDecimal("20.00"))
                .currency("usd")
                .build();

        PaymentIntent first = gateway.createIntent(order);
        PaymentIntent second = gateway.createIntent(order);

        assertThat(first.getPaymentIntentId()).matches("pi_demo_[0-9a-f]{16}");
        assertThat(first.getClientSecret()).isEqualTo(first.getPaymentIntentId() + "_secret_demo");
        assertThat(first.getAmount()).isEqualByComparingTo("20.00");
        assertThat(first.getPaymentIntentId()).isNotEqualTo(second.getPaymentIntentId());
    }

    @Test
    void createRefund_succeedsLocally() {
        Refund refund = gateway.createRefund("pi_demo_1", new BigDecimal("5.00"));

        assertThat(refund.getRefundId()).startsWith("re_demo_");
        assertThat(refund.getStatus()).isEqualTo("succeeded");
    }
}
