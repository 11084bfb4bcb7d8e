package info.mouts.checkout.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import com.fasterxml.jackson.databind.ObjectMapper;

import info.mouts.checkout.config.PaymentProperties;
import info.mouts.checkout.domain.OrderStatus;
import info.mouts.checkout.domain.WebhookOutcome;
import info.mouts.checkout.dto.PaymentWebhookEventDTO;
import info.mouts.checkout.dto.WebhookResultDTO;
import info.mouts.checkout.exception.WebhookSignatureException;
import info.mouts.checkout.repository.ProcessedPaymentEventRepository;
import info.mouts.checkout.util.WebhookUtils;
import info.mouts.checkout.webhook.WebhookSignatureVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
public class PaymentWebhookServiceImplTest {
    private static final String REDIS_KEY = "idempotency:webhook:evt_1";
    private static final byte[] PAYLOAD = ("{\"eventId\":\"evt_1\",\"type\":\"payment_intent.succeeded\","
            + "\"data\":{\"paymentIntentId\":\"pi_1\",\"status\":\"succeeded\"}}").getBytes(StandardCharsets.UTF_8);

    @Mock
    private PaymentEventProcessor eventProcessor;

    @Mock
    private ProcessedPaymentEventRepository processedEventRepository;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private MeterRegistry meterRegistry;
    private WebhookSignatureVerifier signatureVerifier;
    private PaymentWebhookServiceImpl webhookService;
    private String signature;

    @BeforeEach
    void setUp() {
        PaymentProperties properties = new PaymentProperties();
        properties.setWebhookSecret("whsec_test_secret");

        meterRegistry = new SimpleMeterRegistry();
        signatureVerifier = new WebhookSignatureVerifier(properties);
        signature = signatureVerifier.sign(PAYLOAD);

        webhookService = new PaymentWebhookServiceImpl(signatureVerifier, eventProcessor,
                processedEventRepository, redisTemplate, new ObjectMapper(), properties, meterRegistry);

        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(true);
        given(eventProcessor.process(any(PaymentWebhookEventDTO.class))).willReturn(WebhookResultDTO.builder()
                .eventId("evt_1")
                .outcome(WebhookOutcome.APPLIED)
                .orderId(UUID.randomUUID())
                .orderStatus(OrderStatus.PAID)
                .build());
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Signature")
    class SignatureTests {

        @Test
        @DisplayName("Should reject a tampered body before parsing it")
        void handleWebhook_tamperedBody_throwsAndCountsRejection() {
            byte[] tampered = new String(PAYLOAD, StandardCharsets.UTF_8).replace("succeeded\",", "failed\",")
                    .getBytes(StandardCharsets.UTF_8);

            assertThrows(WebhookSignatureException.class, () -> webhookService.handleWebhook(tampered, signature));

            verify(eventProcessor, never()).process(any());
            verify(redisTemplate, never()).opsForValue();
            assertThat(counter("payments.webhooks.rejected")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject a delivery without a signature")
        void handleWebhook_missingSignature_throws() {
            assertThrows(WebhookSignatureException.class, () -> webhookService.handleWebhook(PAYLOAD, null));
        }
    }

    @Test
    @DisplayName("Should process a new event and mark it processed in Redis")
    void handleWebhook_newEvent_processesAndMarks() {
        WebhookResultDTO result = webhookService.handleWebhook(PAYLOAD, signature);

        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.APPLIED);
        verify(valueOperations).setIfAbsent(eq(REDIS_KEY), eq(WebhookUtils.PROCESSING_STATUS),
                any(Duration.class));
        verify(valueOperations).set(eq(REDIS_KEY), eq(WebhookUtils.PROCESSED_STATUS), any(Duration.class));
        assertThat(counter("payments.webhooks.received")).isEqualTo(1.0);
        assertThat(counter("payments.webhooks.applied")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should answer DUPLICATE from Redis without reaching the database")
    void handleWebhook_processedInRedis_returnsDuplicate() {
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(false);
        given(valueOperations.get(REDIS_KEY)).willReturn(WebhookUtils.PROCESSED_STATUS);

        WebhookResultDTO result = webhookService.handleWebhook(PAYLOAD, signature);

        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.DUPLICATE);
        verify(eventProcessor, never()).process(any());
        assertThat(counter("payments.webhooks.duplicates")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should defer to the database when another delivery holds the key")
    void handleWebhook_inProgressInRedis_stillProcesses() {
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(false);
        given(valueOperations.get(REDIS_KEY)).willReturn(WebhookUtils.PROCESSING_STATUS);
        given(eventProcessor.process(any())).willThrow(new RuntimeException("boom"));

        assertThrows(RuntimeException.class, () -> webhookService.handleWebhook(PAYLOAD, signature));

        verify(eventProcessor).process(any());
        verify(redisTemplate, never()).delete(anyString());
    }

    @Test
    @DisplayName("Should keep working when Redis is down")
    void handleWebhook_redisUnavailable_processesThroughDatabase() {
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .willThrow(new RedisConnectionFailureException("Connection refused"));
        given(redisTemplate.opsForValue()).willReturn(valueOperations);

        WebhookResultDTO result = webhookService.handleWebhook(PAYLOAD, signature);

        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.APPLIED);
        verify(eventProcessor).process(any());
    }

    @Test
    @DisplayName("Should map a concurrent insert of the same event id to DUPLICATE")
    void handleWebhook_concurrentRecord_returnsDuplicate() {
        given(eventProcessor.process(any())).willThrow(new DataIntegrityViolationException("duplicate key"));
        given(processedEventRepository.existsById("evt_1")).willReturn(true);

        WebhookResultDTO result = webhookService.handleWebhook(PAYLOAD, signature);

        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.DUPLICATE);
        verify(valueOperations).set(eq(REDIS_KEY), eq(WebhookUtils.PROCESSED_STATUS), any(Duration.class));
    }

    @Test
    @DisplayName("Should rethrow a constraint violation when no record of the event exists")
    void handleWebhook_constraintViolationWithoutRecord_releasesKeyAndRethrows() {
        given(eventProcessor.process(any())).willThrow(new DataIntegrityViolationException("value too long"));
        given(processedEventRepository.existsById("evt_1")).willReturn(false);

        assertThrows(DataIntegrityViolationException.class, () -> webhookService.handleWebhook(PAYLOAD, signature));

        verify(redisTemplate).delete(REDIS_KEY);
        verify(valueOperations, never()).set(anyString(), eq(WebhookUtils.PROCESSED_STATUS), any(Duration.class));
        assertThat(counter("payments.webhooks.duplicates")).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Should acknowledge an event id too long to record as IGNORED")
    void handleWebhook_overlongEventId_returnsIgnored() {
        byte[] payload = ("{\"eventId\":\"" + "e".repeat(304) + "\",\"type\":\"payment_intent.succeeded\","
                + "\"data\":{\"paymentIntentId\":\"pi_1\",\"status\":\"succeeded\"}}")
                .getBytes(StandardCharsets.UTF_8);

        WebhookResultDTO result = webhookService.handleWebhook(payload, signatureVerifier.sign(payload));

        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.IGNORED);
        verify(eventProcessor, never()).process(any());
        verify(redisTemplate, never()).opsForValue();
        assertThat(counter("payments.webhooks.ignored")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should release the Redis key so the processor can retry after a failure")
    void handleWebhook_processingFails_releasesKeyAndRethrows() {
        given(eventProcessor.process(any())).willThrow(new IllegalStateException("database down"));

        assertThrows(IllegalStateException.class, () -> webhookService.handleWebhook(PAYLOAD, signature));

        verify(redisTemplate).delete(REDIS_KEY);
        verify(valueOperations, never()).set(anyString(), eq(WebhookUtils.PROCESSED_STATUS), any(Duration.class));
    }

    @Test
    @DisplayName("Should acknowledge a signed body that is not JSON as IGNORED")
    void handleWebhook_signedGarbage_returnsIgnored() {
        byte[] garbage = "not json".getBytes(StandardCharsets.UTF_8);

        WebhookResultDTO result = webhookService.handleWebhook(garbage, signatureVerifier.sign(garbage));

        assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.IGNORED);
        verify(eventProcessor, never()).process(any());
        assertThat(counter("payments.webhooks.ignored")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should count ALREADY_APPLIED as a duplicate delivery")
    void handleWebhook_alreadyApplied_countsDuplicate() {
        given(eventProcessor.process(any())).willReturn(WebhookResultDTO.of("evt_1", WebhookOutcome.ALREADY_APPLIED));

        webhookService.handleWebhook(PAYLOAD, signature);

        assertThat(counter("payments.webhooks.duplicates")).isEqualTo(1.0);
        assertThat(counter("payments.webhooks.applied")).isEqualTo(0.0);
    }
}
