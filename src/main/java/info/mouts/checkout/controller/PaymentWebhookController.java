package info.mouts.checkout.controller;

import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import info.mouts.checkout.dto.WebhookResultDTO;
import info.mouts.checkout.service.PaymentWebhookService;
import info.mouts.checkout.util.WebhookUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;

/**
 * Receives the payment processor's webhooks. The body is taken as raw bytes so
 * the signature is checked against exactly what was sent.
 */
@RestController
@RequestMapping("/api/v1/payments")
@Tag(name = "Payments API", description = "Webhook endpoint for the payment processor")
@Slf4j
public class PaymentWebhookController {
    private final PaymentWebhookService paymentWebhookService;

    public PaymentWebhookController(PaymentWebhookService paymentWebhookService) {
        this.paymentWebhookService = paymentWebhookService;
    }

    @PostMapping(value = "/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Payment Webhook", description = "Verifies and applies a payment event. Every verified delivery is acknowledged with 200, including duplicates.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery acknowledged", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = WebhookResultDTO.class))),
            @ApiResponse(responseCode = "400", description = "Missing or invalid signature", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Unexpected error, the processor should redeliver", content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<WebhookResultDTO> handleWebhook(@RequestBody(required = false) byte[] payload,
            @RequestHeader(name = WebhookUtils.SIGNATURE_HEADER, required = false) String signature) {
        WebhookResultDTO result = paymentWebhookService.handleWebhook(payload == null ? new byte[0] : payload,
                signature);

        log.debug("Webhook event {} handled with outcome {}", result.getEventId(), result.getOutcome());
        return ResponseEntity.ok(result);
    }
}
