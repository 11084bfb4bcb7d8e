package info.mouts.checkout.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;

import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.WebhookOutcome;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Acknowledgement of a webhook delivery")
public class WebhookResultDTO {
    @Schema(description = "Processor event id", example = "evt_1N2b3c")
    private String eventId;

    @Schema(description = "How the delivery was handled", example = "APPLIED")
    private WebhookOutcome outcome;

    @Schema(description = "Order affected by the event, when one was found")
    private UUID orderId;

    @Schema(description = "Status of the order after handling the event", example = "PAID")
    private OrderStatus orderStatus;

    public static WebhookResultDTO of(String eventId, WebhookOutcome outcome) {
        return WebhookResultDTO.builder().eventId(eventId).outcome(outcome).build();
    }
}
