package info.mouts.checkout.service;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.gateway.PaymentIntentResult;
import info.mouts.checkout.gateway.Refund;

public interface PaymentIntentService {
    /**
     * Opens a payment intent at the processor and assigns it to the order,
     * moving the order to {@code PAYMENT_PROCESSING}. When the assignment fails
     * the intent is cancelled at the processor before the error is rethrown.
     *
     * @param order A {@code PENDING} order without a payment intent.
     * @return The updated order and the intent.
     */
    PaymentIntentResult createIntent(Order order);

    /**
     * Refunds the full amount of the order's payment intent.
     *
     * @param order A paid order.
     * @return The refund created at the processor.
     */
    Refund refund(Order order);
}
