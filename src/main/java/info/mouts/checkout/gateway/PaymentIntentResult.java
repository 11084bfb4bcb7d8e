package info.mouts.checkout.gateway;

import info.mouts.checkout.domain.Order;
import lombok.Value;

/**
 * A payment intent together with the order it was assigned to.
 */
@Value
public class PaymentIntentResult {
    Order order;
    PaymentIntent paymentIntent;
}
