package info.mouts.checkout.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Getter;
import lombok.Setter;

/**
 * Settings of the payment processor integration, bound from
 * {@code app.payment.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "app.payment")
public class PaymentProperties {

    /** {@code stripe} talks to the processor, {@code demo} fakes intents locally. */
    private String mode = "stripe";

    private String baseUrl = "https://api.stripe.com";
    private String secretKey;
    private String webhookSecret;
    private String currency = "usd";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);

    private Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Idempotency {
        private String keyPrefix = "idempotency:webhook:";
        private Duration processingTtl = Duration.ofHours(1);
        private Duration processedTtl = Duration.ofDays(1);
    }
}
