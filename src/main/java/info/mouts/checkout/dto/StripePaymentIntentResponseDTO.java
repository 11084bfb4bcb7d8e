package info.mouts.checkout.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Subset of the processor's payment intent object.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StripePaymentIntentResponseDTO {
    private String id;

    @JsonProperty("client_secret")
    private String clientSecret;

    private Long amount;
    private String currency;
    private String status;
}
