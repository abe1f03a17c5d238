package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.config.CheckoutProperties;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.domain.ticket.Ticket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 재고 검증
 * <p>
 * 남은 수량 = ticket.quantity - (PENDING + CONFIRMED 주문 수량 합)
 * <p>
 * 읽기-후-쓰기 경쟁을 막기 위해 반드시 티켓 row 잠금(SELECT FOR UPDATE)을 잡은 트랜잭션 안에서,
 * 주문 INSERT 직전에 호출해야 한다. 트랜잭션 밖 호출은 MANDATORY 전파로 즉시 실패한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InventoryGuard {

    private final OrderRepository orderRepository;
    private final CheckoutProperties checkoutProperties;
    private final Clock clock;

    /**
     * @return 이번 주문을 반영한 뒤의 남은 수량
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long checkAndReserve(Ticket ticket, int quantity) {
        if (quantity < 1) {
            throw new BusinessException(ErrorCode.INVALID_QUANTITY);
        }

        if (quantity > checkoutProperties.maxQuantityPerOrder()) {
            throw new BusinessException(
                ErrorCode.PER_ORDER_LIMIT_EXCEEDED,
                String.format("Quantity exceeds the per-order limit of %d", checkoutProperties.maxQuantityPerOrder())
            );
        }

        if (!ticket.isOnSaleAt(LocalDateTime.now(clock))) {
            throw new BusinessException(ErrorCode.SALE_NOT_ACTIVE);
        }

        long held = orderRepository.sumHeldQuantity(ticket.getId());
        long remaining = ticket.getQuantity() - held;
        if (quantity > remaining) {
            log.warn("재고 부족: ticketId={}, requested={}, remaining={}", ticket.getId(), quantity, remaining);
            throw new BusinessException(ErrorCode.TICKET_SOLD_OUT);
        }

        return remaining - quantity;
    }
}
