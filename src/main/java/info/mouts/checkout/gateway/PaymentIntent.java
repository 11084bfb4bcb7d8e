package info.mouts.checkout.gateway;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * Payment intent opened at the processor. {@code amount} is in major units.
 */
@Value
@Builder
public class PaymentIntent {
    String paymentIntentId;
    String clientSecret;
    BigDecimal amount;
    String currency;
    String status;
}
