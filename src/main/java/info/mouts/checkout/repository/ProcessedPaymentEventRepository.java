package info.mouts.checkout.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import info.mouts.checkout.domain.ProcessedPaymentEvent;

/**
 * Repository for the processor events that were already handled, keyed by
 * the processor's event id.
 */
@Repository
public interface ProcessedPaymentEventRepository extends JpaRepository<ProcessedPaymentEvent, String> {
}
