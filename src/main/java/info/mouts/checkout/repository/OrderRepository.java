package info.mouts.checkout.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import info.mouts.checkout.domain.Order;
import info.mouts.checkout.domain.OrderStatus;

/**
 * Repository interface for managing {@link Order} entities.
 * <p>
 * Every status change goes through one of the conditional updates below. They
 * only touch the row when it still holds the expected status, so the returned
 * row count tells the caller whether it won the transition.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {
    /**
     * Finds the order holding the given payment intent.
     *
     * @param paymentIntentId the processor's payment intent id
     * @return an optional containing the order if found, or empty if not found
     */
    Optional<Order> findByPaymentIntentId(String paymentIntentId);

    Page<Order> findByUserId(String userId, Pageable pageable);

    Optional<Order> findByOrderNumber(String orderNumber);

    boolean existsByOrderNumber(String orderNumber);

    long countByCreatedAtGreaterThanEqual(LocalDateTime since);

    /**
     * Sums the totals of the orders created since {@code since} that hold
     * {@code status}.
     *
     * @return the sum, {@code null} when no order matches
     */
    @Query("select sum(o.totalAmount) from PurchaseOrder o "
            + "where o.status = :status and o.createdAt >= :since")
    BigDecimal sumTotalAmountByStatusSince(@Param("status") OrderStatus status,
            @Param("since") LocalDateTime since);

    /**
     * Counts the orders created since {@code since}, grouped by status. Statuses
     * without orders are absent from the result.
     */
    @Query("select o.status as status, count(o) as total from PurchaseOrder o "
            + "where o.createdAt >= :since group by o.status")
    List<StatusCount> countByStatusSince(@Param("since") LocalDateTime since);

    /**
     * Moves the order from {@code expected} to {@code target}.
     *
     * @return the number of rows updated, {@code 0} when the order no longer holds
     *         the expected status (or does not exist)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update PurchaseOrder o set o.status = :target, o.updatedAt = :now, o.version = o.version + 1 "
            + "where o.id = :orderId and o.status = :expected")
    int compareAndSetStatus(@Param("orderId") UUID orderId, @Param("expected") OrderStatus expected,
            @Param("target") OrderStatus target, @Param("now") LocalDateTime now);

    /**
     * Same as {@link #compareAndSetStatus} but also records a failure or
     * cancellation reason.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update PurchaseOrder o set o.status = :target, o.failureReason = :reason, o.updatedAt = :now, "
            + "o.version = o.version + 1 where o.id = :orderId and o.status = :expected")
    int compareAndSetStatusWithReason(@Param("orderId") UUID orderId, @Param("expected") OrderStatus expected,
            @Param("target") OrderStatus target, @Param("reason") String reason, @Param("now") LocalDateTime now);

    /**
     * Assigns a payment intent and moves the order from {@code PENDING} to
     * {@code PAYMENT_PROCESSING} in one statement. Only applies to a pending order
     * that holds no intent yet.
     *
     * @return the number of rows updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update PurchaseOrder o set o.paymentIntentId = :paymentIntentId, "
            + "o.status = info.mouts.checkout.domain.OrderStatus.PAYMENT_PROCESSING, "
            + "o.updatedAt = :now, o.version = o.version + 1 "
            + "where o.id = :orderId and o.status = info.mouts.checkout.domain.OrderStatus.PENDING "
            + "and o.paymentIntentId is null")
    int assignPaymentIntent(@Param("orderId") UUID orderId, @Param("paymentIntentId") String paymentIntentId,
            @Param("now") LocalDateTime now);

    /**
     * Number of orders holding one status.
     */
    interface StatusCount {
        OrderStatus getStatus();

        Long getTotal();
    }
}
