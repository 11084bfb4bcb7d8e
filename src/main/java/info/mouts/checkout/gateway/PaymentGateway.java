package info.mouts.checkout.gateway;

import java.math.BigDecimal;
import java.math.RoundingMode;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.exception.PaymentGatewayException;

/**
 * Port to the external payment processor. Implementations never retry on their
 * own: every I/O error, timeout or rejected request surfaces as a
 * {@link PaymentGatewayException}.
 */
public interface PaymentGateway {
    /**
     * Opens a payment intent for the order's total amount. The order id, number
     * and owner are attached as metadata.
     *
     * @param order The order to charge.
     * @return The created intent.
     * @throws PaymentGatewayException If the processor call fails.
     */
    PaymentIntent createIntent(Order order);

    /**
     * Cancels an intent that was not confirmed yet.
     *
     * @param paymentIntentId The intent to cancel.
     * @throws PaymentGatewayException If the processor call fails.
     */
    void cancelIntent(String paymentIntentId);

    /**
     * Refunds a confirmed intent.
     *
     * @param paymentIntentId The intent to refund.
     * @param amount          The amount to refund in major units, {@code null}
     *                        for the full amount.
     * @return The created refund.
     * @throws PaymentGatewayException If the processor call fails.
     */
    Refund createRefund(String paymentIntentId, BigDecimal amount);

    /**
     * Converts an amount in major units to the processor's minor units (cents).
     *
     * @param amount The amount with up to two decimals.
     * @return The amount in minor units.
     */
    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    static BigDecimal fromMinorUnits(Long amount) {
        return amount == null ? null : BigDecimal.valueOf(amount).movePointLeft(2);
    }
}
