package info.mouts.checkout.controller;

import java.net.URI;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.checkout.dto.CheckoutResponseDTO;
import info.mouts.checkout.service.CheckoutService;
import info.mouts.checkout.util.RequestHeaders;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

import static org.springframework.hateoas.server.mvc.WebMvcLinkBuilder.*;

/**
 * REST controller that turns the caller's cart into an order awaiting payment.
 */
@RestController
@RequestMapping("/api/v1/checkout")
@Tag(name = "Checkout API", description = "Endpoints for creating orders and their payment intents")
@Slf4j
public class CheckoutController {
    private final CheckoutService checkoutService;

    public CheckoutController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    /**
     * Creates an order from the caller's cart and opens its payment intent.
     *
     * @param userId The caller, forwarded by the gateway.
     * @return HTTP 201 with the {@link CheckoutResponseDTO} and the order's
     *         location.
     */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Checkout", description = "Creates an order from the caller's cart and opens a payment intent for it.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Order created and payment intent opened", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = CheckoutResponseDTO.class))),
            @ApiResponse(responseCode = "400", description = "Empty cart, unavailable product or missing user header", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment processor error, the order stays pending", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "503", description = "Cart or catalog unavailable", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CheckoutResponseDTO> checkout(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        CheckoutResponseDTO response = checkoutService.initiateCheckout(userId);

        URI location = linkTo(methodOn(OrderController.class).findByOrderId(response.getOrderId(), null, null))
                .toUri();

        return ResponseEntity.status(HttpStatus.CREATED).location(location).body(response);
    }

    @PostMapping(value = "/orders/{orderId}/payment-intent", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Retry Payment", description = "Opens a new payment intent for a pending order, e.g. after the processor was unreachable.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment intent opened", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = CheckoutResponseDTO.class))),
            @ApiResponse(responseCode = "403", description = "Caller neither owns the order nor is an administrator", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Order not found for the given ID", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Order is no longer pending", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "502", description = "Payment processor error", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CheckoutResponseDTO> retryPayment(@PathVariable UUID orderId,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestHeader(name = RequestHeaders.USER_ROLE, required = false) String role) {
        return ResponseEntity.ok(checkoutService.retryPayment(orderId, OrderController.requester(userId, role)));
    }
}
