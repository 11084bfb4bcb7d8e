package info.mouts.checkout.service.impl;

import java.io.IOException;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;

import info.mouts.checkout.config.PaymentProperties;
import info.mouts.checkout.domain.ProcessedPaymentEvent;
import info.mouts.checkout.domain.WebhookOutcome;
import info.mouts.checkout.dto.PaymentWebhookEventDTO;
import info.mouts.checkout.dto.WebhookResultDTO;
import info.mouts.checkout.exception.WebhookSignatureException;
import info.mouts.checkout.repository.ProcessedPaymentEventRepository;
import info.mouts.checkout.service.PaymentWebhookService;
import info.mouts.checkout.util.WebhookUtils;
import info.mouts.checkout.webhook.WebhookSignatureVerifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Implementation of the {@link PaymentWebhookService} interface.
 * <p>
 * A delivery is verified before its body is parsed. Redis keeps a short-lived
 * marker per event id so that replays are answered without touching the
 * database; the {@code processed_payment_events} table stays the authority
 * whenever Redis is unavailable or the marker is still {@code PROCESSING}.
 */
@Service
@Slf4j
public class PaymentWebhookServiceImpl implements PaymentWebhookService {
    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentEventProcessor eventProcessor;
    private final ProcessedPaymentEventRepository processedEventRepository;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final PaymentProperties.Idempotency idempotency;
    private final MeterRegistry meterRegistry;

    private Counter receivedWebhooksCounter;
    private Counter rejectedWebhooksCounter;
    private Counter duplicateWebhooksCounter;
    private Counter appliedWebhooksCounter;
    private Counter ignoredWebhooksCounter;

    /**
     * Constructs an instance of {@code PaymentWebhookServiceImpl}.
     *
     * @param signatureVerifier Verifies the processor's signature.
     * @param eventProcessor    Applies the event in a transaction.
     * @param processedEventRepository Confirms that a rejected insert was a
     *                          concurrent delivery of the same event.
     * @param redisTemplate     The Spring Redis template used for the
     *                          idempotency fast path.
     * @param objectMapper      Parses the verified payload.
     * @param paymentProperties Holds the idempotency key prefix and TTLs.
     * @param meterRegistry     The registry for collecting metrics.
     */
    public PaymentWebhookServiceImpl(WebhookSignatureVerifier signatureVerifier,
            PaymentEventProcessor eventProcessor, ProcessedPaymentEventRepository processedEventRepository,
            StringRedisTemplate redisTemplate, ObjectMapper objectMapper, PaymentProperties paymentProperties,
            MeterRegistry meterRegistry) {
        this.signatureVerifier = signatureVerifier;
        this.eventProcessor = eventProcessor;
        this.processedEventRepository = processedEventRepository;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.idempotency = paymentProperties.getIdempotency();
        this.meterRegistry = meterRegistry;

        initializeMetrics(this.meterRegistry);
    }

    @Override
    public WebhookResultDTO handleWebhook(byte[] payload, String signatureHeader) {
        receivedWebhooksCounter.increment();

        try {
            signatureVerifier.verify(payload, signatureHeader);
        } catch (WebhookSignatureException e) {
            rejectedWebhooksCounter.increment();
            log.warn("Rejecting webhook: {}", e.getMessage());
            throw e;
        }

        PaymentWebhookEventDTO event = parse(payload);
        if (event == null || event.getEventId() == null || event.getEventId().isBlank()) {
            log.error("Signed webhook without a usable event id, acknowledging without changes");
            ignoredWebhooksCounter.increment();
            return WebhookResultDTO.of(event == null ? null : event.getEventId(), WebhookOutcome.IGNORED);
        }

        if (!fitsRecord(event)) {
            log.error("Signed webhook {} carries identifiers longer than {} characters, acknowledging without "
                    + "changes", abbreviate(event.getEventId()), ProcessedPaymentEvent.MAX_TEXT_LENGTH);
            ignoredWebhooksCounter.increment();
            return WebhookResultDTO.of(null, WebhookOutcome.IGNORED);
        }

        String eventId = event.getEventId();
        String redisKey = idempotency.getKeyPrefix() + eventId;

        FastPath fastPath = acquire(redisKey, eventId);
        if (fastPath == FastPath.ALREADY_PROCESSED) {
            log.info("Webhook event {} already processed, skipping", eventId);
            duplicateWebhooksCounter.increment();
            return WebhookResultDTO.of(eventId, WebhookOutcome.DUPLICATE);
        }

        try {
            WebhookResultDTO result = eventProcessor.process(event);
            markProcessed(redisKey);
            count(result.getOutcome());
            return result;
        } catch (DataIntegrityViolationException e) {
            if (!processedEventRepository.existsById(eventId)) {
                log.error("Webhook event {} violated a constraint other than its event id: {}", eventId,
                        e.getMessage());
                if (fastPath == FastPath.ACQUIRED) {
                    release(redisKey);
                }
                throw e;
            }

            log.warn("Webhook event {} was recorded by a concurrent delivery: {}", eventId, e.getMessage());
            markProcessed(redisKey);
            duplicateWebhooksCounter.increment();
            return WebhookResultDTO.of(eventId, WebhookOutcome.DUPLICATE);
        } catch (RuntimeException e) {
            log.error("Error processing webhook event {}: {}", eventId, e.getMessage(), e);
            if (fastPath == FastPath.ACQUIRED) {
                release(redisKey);
            }
            throw e;
        }
    }

    private PaymentWebhookEventDTO parse(byte[] payload) {
        try {
            return objectMapper.readValue(payload, PaymentWebhookEventDTO.class);
        } catch (IOException e) {
            log.error("Signed webhook payload is not valid JSON: {}", e.getMessage());
            return null;
        }
    }

    private boolean fitsRecord(PaymentWebhookEventDTO event) {
        return fits(event.getEventId()) && fits(event.getType()) && fits(event.paymentIntentId());
    }

    private boolean fits(String value) {
        return value == null || value.length() <= ProcessedPaymentEvent.MAX_TEXT_LENGTH;
    }

    private String abbreviate(String value) {
        return value.length() > 32 ? value.substring(0, 32) + "..." : value;
    }

    /**
     * Tries to claim the event id in Redis.
     *
     * @param redisKey The idempotency key.
     * @param eventId  The processor event id, for logging.
     * @return The state of the fast path for this delivery.
     */
    private FastPath acquire(String redisKey, String eventId) {
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(redisKey, WebhookUtils.PROCESSING_STATUS,
                    idempotency.getProcessingTtl());

            if (!Boolean.FALSE.equals(acquired)) {
                return FastPath.ACQUIRED;
            }

            String currentStatus = redisTemplate.opsForValue().get(redisKey);
            if (WebhookUtils.PROCESSED_STATUS.equals(currentStatus)) {
                return FastPath.ALREADY_PROCESSED;
            }

            log.warn("Webhook event {} is marked as {} in Redis, deferring to the database", eventId,
                    currentStatus);
            return FastPath.IN_PROGRESS;
        } catch (DataAccessException e) {
            log.warn("Redis unavailable for webhook event {}, deferring to the database: {}", eventId,
                    e.getMessage());
            return FastPath.UNAVAILABLE;
        }
    }

    private void markProcessed(String redisKey) {
        try {
            redisTemplate.opsForValue().set(redisKey, WebhookUtils.PROCESSED_STATUS, idempotency.getProcessedTtl());
        } catch (DataAccessException e) {
            log.warn("Could not mark {} as processed in Redis: {}", redisKey, e.getMessage());
        }
    }

    private void release(String redisKey) {
        try {
            redisTemplate.delete(redisKey);
        } catch (DataAccessException e) {
            log.warn("Could not release {} in Redis: {}", redisKey, e.getMessage());
        }
    }

    private void count(WebhookOutcome outcome) {
        switch (outcome) {
            case APPLIED:
                appliedWebhooksCounter.increment();
                break;
            case DUPLICATE:
            case ALREADY_APPLIED:
                duplicateWebhooksCounter.increment();
                break;
            default:
                ignoredWebhooksCounter.increment();
        }
    }

    /**
     * Initializes the Micrometer metrics for the webhook endpoint.
     *
     * @param registry The meter registry to register the metrics with.
     */
    private void initializeMetrics(MeterRegistry registry) {
        this.receivedWebhooksCounter = Counter.builder("payments.webhooks.received")
                .description("Total number of webhook deliveries received")
                .register(registry);
        this.rejectedWebhooksCounter = Counter.builder("payments.webhooks.rejected")
                .description("Webhook deliveries rejected for a missing or invalid signature")
                .register(registry);
        this.duplicateWebhooksCounter = Counter.builder("payments.webhooks.duplicates")
                .description("Webhook deliveries that repeated an event or an already applied change")
                .register(registry);
        this.appliedWebhooksCounter = Counter.builder("payments.webhooks.applied")
                .description("Webhook deliveries that changed an order")
                .register(registry);
        this.ignoredWebhooksCounter = Counter.builder("payments.webhooks.ignored")
                .description("Webhook deliveries acknowledged without changes (unknown type, unknown intent, stale)")
                .register(registry);
    }

    private enum FastPath {
        ACQUIRED,
        ALREADY_PROCESSED,
        IN_PROGRESS,
        UNAVAILABLE
    }
}
