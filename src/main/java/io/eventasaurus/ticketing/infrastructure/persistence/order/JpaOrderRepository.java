package io.eventasaurus.ticketing.infrastructure.persistence.order;

import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.domain.order.OrderStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

@Repository
@Primary
public interface JpaOrderRepository extends JpaRepository<Order, Long>, OrderRepository {

    // Explicitly declare methods to resolve ambiguity with OrderRepository
    @Override
    Optional<Order> findById(Long id);

    @Override
    Order save(Order order);

    @Override
    Optional<Order> findByPaymentReference(String paymentReference);

    @Override
    Optional<Order> findByStripeSessionId(String stripeSessionId);

    @Override
    @Query("SELECT COALESCE(SUM(o.quantity), 0) FROM Order o " +
           "WHERE o.ticketId = :ticketId AND o.status IN :statuses")
    long sumQuantityByTicketIdAndStatusIn(@Param("ticketId") Long ticketId,
                                          @Param("statuses") Collection<OrderStatus> statuses);

    /**
     * 조건부 UPDATE (WHERE status = PENDING)
     * - 동시에 들어온 웹훅/싱크 중 affected row = 1 을 받은 쪽만 전이를 수행한 것으로 본다
     * - confirmed_at 은 이 UPDATE 에서만 설정되므로 한 번만 기록된다
     */
    @Override
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET " +
           "o.status = io.eventasaurus.ticketing.domain.order.OrderStatus.CONFIRMED, " +
           "o.confirmedAt = :confirmedAt, " +
           "o.confirmationEventId = :confirmationEventId, " +
           "o.updatedAt = :confirmedAt " +
           "WHERE o.id = :id AND o.status = io.eventasaurus.ticketing.domain.order.OrderStatus.PENDING")
    int confirmIfPending(@Param("id") Long id,
                         @Param("confirmedAt") LocalDateTime confirmedAt,
                         @Param("confirmationEventId") String confirmationEventId);

    @Override
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET " +
           "o.stripeSessionId = :stripeSessionId, " +
           "o.paymentReference = COALESCE(o.paymentReference, :paymentReference), " +
           "o.updatedAt = :now " +
           "WHERE o.id = :id")
    int attachCheckoutSession(@Param("id") Long id,
                              @Param("stripeSessionId") String stripeSessionId,
                              @Param("paymentReference") String paymentReference,
                              @Param("now") LocalDateTime now);

    @Override
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.paymentReference = :paymentReference, o.updatedAt = :now " +
           "WHERE o.id = :id AND o.paymentReference IS NULL")
    int attachPaymentReferenceIfAbsent(@Param("id") Long id,
                                       @Param("paymentReference") String paymentReference,
                                       @Param("now") LocalDateTime now);
}
