package info.mouts.checkout.service;

import info.mouts.checkout.dto.WebhookResultDTO;
import info.mouts.checkout.exception.WebhookSignatureException;

public interface PaymentWebhookService {
    /**
     * Verifies, deduplicates and applies one webhook delivery.
     *
     * @param payload         The raw request body, exactly as received.
     * @param signatureHeader The signature sent by the processor.
     * @return How the delivery was handled. Every outcome is acknowledged.
     * @throws WebhookSignatureException If the signature is missing or invalid.
     *                                   No state is changed in that case.
     */
    WebhookResultDTO handleWebhook(byte[] payload, String signatureHeader);
}
