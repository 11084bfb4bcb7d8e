package info.mouts.checkout.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StripeRefundResponseDTO {
    private String id;
    private Long amount;
    private String status;

    @JsonProperty("payment_intent")
    private String paymentIntent;
}
