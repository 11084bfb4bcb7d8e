package info.mouts.checkout.service.impl;

import org.springframework.stereotype.Service;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.exception.OrderStatusConflictException;
import info.mouts.checkout.exception.PaymentGatewayException;
import info.mouts.checkout.gateway.PaymentGateway;
import info.mouts.checkout.gateway.PaymentIntent;
import info.mouts.checkout.gateway.PaymentIntentResult;
import info.mouts.checkout.gateway.Refund;
import info.mouts.checkout.service.OrderService;
import info.mouts.checkout.service.PaymentIntentService;
import lombok.extern.slf4j.Slf4j;

/**
 * Pairs the remote payment intent calls with the order store updates. No
 * database transaction is held open while the processor is called.
 */
@Service
@Slf4j
public class PaymentIntentServiceImpl implements PaymentIntentService {
    private final PaymentGateway paymentGateway;
    private final OrderService orderService;

    public PaymentIntentServiceImpl(PaymentGateway paymentGateway, OrderService orderService) {
        this.paymentGateway = paymentGateway;
        this.orderService = orderService;
    }

    @Override
    public PaymentIntentResult createIntent(Order order) {
        if (order.getStatus() != OrderStatus.PENDING || order.getPaymentIntentId() != null) {
            log.warn("Order {} is {} and cannot receive a new payment intent", order.getId(), order.getStatus());
            throw new OrderStatusConflictException(order.getId(), OrderStatus.PENDING, order.getStatus());
        }

        PaymentIntent intent = paymentGateway.createIntent(order);

        try {
            Order updatedOrder = orderService.assignPaymentIntent(order.getId(), intent.getPaymentIntentId());
            return new PaymentIntentResult(updatedOrder, intent);
        } catch (RuntimeException e) {
            log.warn("Could not assign payment intent {} to order {}, cancelling it: {}",
                    intent.getPaymentIntentId(), order.getId(), e.getMessage());
            cancelQuietly(intent.getPaymentIntentId());
            throw e;
        }
    }

    @Override
    public Refund refund(Order order) {
        if (order.getPaymentIntentId() == null) {
            throw new OrderStatusConflictException(order.getId(), OrderStatus.PAID, order.getStatus());
        }

        Refund refund = paymentGateway.createRefund(order.getPaymentIntentId(), order.getTotalAmount());
        log.info("Refund {} created for order {} ({} {})", refund.getRefundId(), order.getId(),
                order.getTotalAmount(), order.getCurrency());

        return refund;
    }

    private void cancelQuietly(String paymentIntentId) {
        try {
            paymentGateway.cancelIntent(paymentIntentId);
        } catch (PaymentGatewayException e) {
            log.error("Failed to cancel orphaned payment intent {}: {}", paymentIntentId, e.getMessage());
        }
    }
}
