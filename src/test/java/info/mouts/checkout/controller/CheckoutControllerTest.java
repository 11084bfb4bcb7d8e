package info.mouts.checkout.controller;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.Requester;
import info.mouts.checkout.dto.CheckoutResponseDTO;
import info.mouts.checkout.exception.CollaboratorUnavailableException;
import info.mouts.checkout.exception.OrderStatusConflictException;
import info.mouts.checkout.exception.OrderValidationException;
import info.mouts.checkout.exception.PaymentGatewayException;
import info.mouts.checkout.service.CheckoutService;
import info.mouts.checkout.util.RequestHeaders;

@WebMvcTest(CheckoutController.class)
public class CheckoutControllerTest {
    private static final String BASE_API_URL = "/api/v1/checkout";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CheckoutService checkoutService;

    private final UUID orderId = UUID.randomUUID();

    @Test
    @DisplayName("Should return 201 Created with the client secret and the order location")
    void checkout_shouldReturnCreated() throws Exception {
        given(checkoutService.initiateCheckout("user-1")).willReturn(CheckoutResponseDTO.builder()
                .orderId(orderId)
                .orderNumber("ORD-20250401-ABCDEF12")
                .paymentIntentId("pi_1")
                .clientSecret("pi_1_secret")
                .totalAmount(new BigDecimal("20.00"))
                .currency("usd")
                .status(OrderStatus.PAYMENT_PROCESSING)
                .build());

        mockMvc.perform(post(BASE_API_URL).header(RequestHeaders.USER_ID, "user-1"))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", endsWith("/api/v1/orders/" + orderId)))
                .andExpect(jsonPath("$.clientSecret", is("pi_1_secret")))
                .andExpect(jsonPath("$.status", is("PAYMENT_PROCESSING")));
    }

    @Test
    void checkout_emptyCart_shouldReturn400() throws Exception {
        given(checkoutService.initiateCheckout("user-1")).willThrow(new OrderValidationException("Cart is empty."));

        mockMvc.perform(post(BASE_API_URL).header(RequestHeaders.USER_ID, "user-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", is("Cart is empty.")));
    }

    @Test
    void checkout_processorDown_shouldReturn502() throws Exception {
        given(checkoutService.initiateCheckout("user-1"))
                .willThrow(new PaymentGatewayException("Payment processor unavailable"));

        mockMvc.perform(post(BASE_API_URL).header(RequestHeaders.USER_ID, "user-1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.title", is("Payment Gateway Error")));
    }

    @Test
    void checkout_cartServiceDown_shouldReturn503() throws Exception {
        given(checkoutService.initiateCheckout("user-1"))
                .willThrow(new CollaboratorUnavailableException("Cart service unavailable", null));

        mockMvc.perform(post(BASE_API_URL).header(RequestHeaders.USER_ID, "user-1"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void checkout_withoutUserHeader_shouldReturn400() throws Exception {
        mockMvc.perform(post(BASE_API_URL))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should return 409 Conflict when retrying payment for an order that left PENDING")
    void retryPayment_whenNotPending_shouldReturn409() throws Exception {
        given(checkoutService.retryPayment(eq(orderId), any(Requester.class)))
                .willThrow(new OrderStatusConflictException(orderId, OrderStatus.PENDING, OrderStatus.PAID));

        mockMvc.perform(post(BASE_API_URL + "/orders/{orderId}/payment-intent", orderId)
                .header(RequestHeaders.USER_ID, "user-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.currentStatus", is("PAID")));
    }
}
