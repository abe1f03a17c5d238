package io.eventasaurus.ticketing.domain.order;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

public interface OrderRepository {

    Optional<Order> findById(Long id);

    Order save(Order order);

    Optional<Order> findByPaymentReference(String paymentReference);

    Optional<Order> findByStripeSessionId(String stripeSessionId);

    long sumQuantityByTicketIdAndStatusIn(Long ticketId, Collection<OrderStatus> statuses);

    /**
     * PENDING 일 때만 CONFIRMED 로 전이한다.
     *
     * @return 1 이면 이번 호출이 전이를 수행, 0 이면 이미 확정됐거나 주문 없음
     */
    int confirmIfPending(Long id, LocalDateTime confirmedAt, String confirmationEventId);

    int attachCheckoutSession(Long id, String stripeSessionId, String paymentReference, LocalDateTime now);

    /**
     * payment_reference 가 비어 있을 때만 채운다. 기존 값은 덮어쓰지 않는다.
     */
    int attachPaymentReferenceIfAbsent(Long id, String paymentReference, LocalDateTime now);

    /**
     * 재고를 점유 중인(PENDING + CONFIRMED) 주문 수량 합
     */
    default long sumHeldQuantity(Long ticketId) {
        return sumQuantityByTicketIdAndStatusIn(ticketId, OrderStatus.holdingInventory());
    }

    default Order findByIdOrThrow(Long id) {
        return findById(id)
            .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND));
    }
}
