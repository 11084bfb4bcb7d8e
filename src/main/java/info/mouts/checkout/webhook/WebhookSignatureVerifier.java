package info.mouts.checkout.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.stereotype.Component;

import info.mouts.checkout.config.PaymentProperties;
import info.mouts.checkout.exception.WebhookSignatureException;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies the HMAC-SHA256 signature the processor sends with every webhook.
 * The signature is the hex encoded HMAC of the exact raw request body, keyed
 * with {@code app.payment.webhook-secret}.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String SIGNATURE_PREFIX = "sha256=";

    private final PaymentProperties properties;

    public WebhookSignatureVerifier(PaymentProperties properties) {
        this.properties = properties;
    }

    /**
     * Checks the signature in constant time.
     *
     * @param payload         The raw request body.
     * @param signatureHeader The value of the signature header, optionally
     *                        prefixed with {@code sha256=}.
     * @throws WebhookSignatureException If the header is missing, malformed or
     *                                   does not match.
     */
    public void verify(byte[] payload, String signatureHeader) {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing webhook signature");
        }

        String provided = signatureHeader.trim().toLowerCase(Locale.ROOT);
        if (provided.startsWith(SIGNATURE_PREFIX)) {
            provided = provided.substring(SIGNATURE_PREFIX.length());
        }

        byte[] providedBytes;
        try {
            providedBytes = HexFormat.of().parseHex(provided);
        } catch (IllegalArgumentException e) {
            throw new WebhookSignatureException("Malformed webhook signature");
        }

        byte[] expected = hmac(payload == null ? new byte[0] : payload);
        if (!MessageDigest.isEqual(expected, providedBytes)) {
            throw new WebhookSignatureException("Webhook signature mismatch");
        }
    }

    /**
     * Computes the signature the processor would send for the payload.
     *
     * @param payload The raw body.
     * @return The hex encoded HMAC-SHA256.
     */
    public String sign(byte[] payload) {
        return HexFormat.of().formatHex(hmac(payload));
    }

    private byte[] hmac(byte[] payload) {
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Webhook secret is not configured, cannot verify webhook signatures");
            throw new IllegalStateException("app.payment.webhook-secret is not configured");
        }

        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to compute " + HMAC_ALGORITHM, e);
        }
    }
}
