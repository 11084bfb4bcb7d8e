package info.mouts.checkout.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link RestClient} instances for the remote collaborators, each with its own
 * base URL and bounded connect/read timeouts.
 */
@Configuration
@Slf4j
public class HttpClientConfig {
    public static final String PAYMENT_CLIENT = "paymentRestClient";
    public static final String CART_CLIENT = "cartRestClient";
    public static final String CATALOG_CLIENT = "catalogRestClient";

    @Bean
    @Qualifier(PAYMENT_CLIENT)
    @ConditionalOnProperty(name = "app.payment.mode", havingValue = "stripe", matchIfMissing = true)
    public RestClient paymentRestClient(RestClient.Builder builder, PaymentProperties properties) {
        log.info("Configuring payment processor client for {} (connect timeout {}, read timeout {})",
                properties.getBaseUrl(), properties.getConnectTimeout(), properties.getReadTimeout());

        return builder.clone()
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout().toMillis(),
                        properties.getReadTimeout().toMillis()))
                .build();
    }

    @Bean
    @Qualifier(CART_CLIENT)
    public RestClient cartRestClient(RestClient.Builder builder, CollaboratorProperties properties) {
        return builder.clone()
                .baseUrl(properties.getCartUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout().toMillis(),
                        properties.getReadTimeout().toMillis()))
                .build();
    }

    @Bean
    @Qualifier(CATALOG_CLIENT)
    public RestClient catalogRestClient(RestClient.Builder builder, CollaboratorProperties properties) {
        return builder.clone()
                .baseUrl(properties.getCatalogUrl())
                .requestFactory(requestFactory(properties.getConnectTimeout().toMillis(),
                        properties.getReadTimeout().toMillis()))
                .build();
    }

    private SimpleClientHttpRequestFactory requestFactory(long connectTimeoutMillis, long readTimeoutMillis) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeoutMillis);
        factory.setReadTimeout((int) readTimeoutMillis);
        return factory;
    }
}
