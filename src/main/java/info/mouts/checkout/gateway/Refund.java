package info.mouts.checkout.gateway;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Refund {
    String refundId;
    String paymentIntentId;
    BigDecimal amount;
    String status;
}
