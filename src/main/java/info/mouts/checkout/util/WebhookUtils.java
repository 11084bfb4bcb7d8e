package info.mouts.checkout.util;

public final class WebhookUtils {
    public static final String SIGNATURE_HEADER = "Payment-Signature";

    public static final String PROCESSING_STATUS = "PROCESSING";
    public static final String PROCESSED_STATUS = "PROCESSED";

    private WebhookUtils() {
    }
}
