package info.mouts.checkout.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of a processor webhook:
 * {@code {"eventId": "...", "type": "...", "data": {"paymentIntentId": "...", "status": "...", "failureReason": "..."}}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PaymentWebhookEventDTO {
    private String eventId;
    private String type;
    private EventData data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventData {
        private String paymentIntentId;
        private String status;
        private String failureReason;
    }

    public String paymentIntentId() {
        return data == null ? null : data.getPaymentIntentId();
    }
}
