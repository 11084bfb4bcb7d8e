package info.mouts.checkout.domain;

import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.data.domain.Persistable;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Record of a processor event that was already handled, keyed by the
 * processor's event id. Written in the same transaction as the status change
 * it caused and never deleted.
 * <p>
 * Implements {@link Persistable} so that saving always issues an insert: a
 * second delivery of the same event id fails on the primary key instead of
 * silently merging.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "processed_payment_events")
public class ProcessedPaymentEvent implements Persistable<String> {
    /** Width of the text columns; longer values cannot be recorded. */
    public static final int MAX_TEXT_LENGTH = 255;

    @Id
    @Column(name = "external_event_id", nullable = false, updatable = false, length = MAX_TEXT_LENGTH)
    private String externalEventId;

    @Column(name = "event_type", nullable = false, updatable = false, length = MAX_TEXT_LENGTH)
    private String eventType;

    @Column(name = "payment_intent_id", updatable = false, length = MAX_TEXT_LENGTH)
    private String paymentIntentId;

    @Column(name = "order_id", updatable = false)
    private UUID orderId;

    @Column(name = "observed_status", updatable = false, length = MAX_TEXT_LENGTH)
    private String observedStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30, updatable = false)
    private WebhookOutcome outcome;

    @Column(name = "received_at", nullable = false, updatable = false)
    private LocalDateTime receivedAt;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity = true;

    public ProcessedPaymentEvent(String externalEventId, String eventType, String paymentIntentId, UUID orderId,
            String observedStatus, WebhookOutcome outcome) {
        this.externalEventId = externalEventId;
        this.eventType = eventType;
        this.paymentIntentId = paymentIntentId;
        this.orderId = orderId;
        this.observedStatus = observedStatus;
        this.outcome = outcome;
        this.receivedAt = LocalDateTime.now();
    }

    @Override
    public String getId() {
        return externalEventId;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
