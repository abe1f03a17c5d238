package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.config.PaymentProperties;
import io.eventasaurus.ticketing.domain.event.Event;
import io.eventasaurus.ticketing.domain.event.EventRepository;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.domain.order.PriceQuote;
import io.eventasaurus.ticketing.domain.order.PricingCalculator;
import io.eventasaurus.ticketing.domain.ticket.Ticket;
import io.eventasaurus.ticketing.domain.ticket.TicketRepository;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 체크아웃 트랜잭션 처리 서비스
 * <p>
 * CreateCheckoutSessionUseCase 에서 호출되는 @Transactional 메서드를 별도 빈으로 분리해
 * 프록시를 거치게 하고, 외부 결제 API 호출은 트랜잭션 밖에 둔다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutTransactionService {

    private final TicketRepository ticketRepository;
    private final EventRepository eventRepository;
    private final OrderRepository orderRepository;
    private final InventoryGuard inventoryGuard;
    private final PaymentProperties paymentProperties;
    private final Clock clock;

    /**
     * Step 1: PENDING 주문 생성 (트랜잭션)
     * <p>
     * - 티켓 row 잠금 (SELECT FOR UPDATE), 같은 티켓의 체크아웃은 여기서 직렬화
     * - 가격 계산 → 재고 검증 → INSERT 가 잠금 안에서 한 번에 수행되어 초과 판매가 불가능
     * - 어느 단계든 실패하면 롤백되어 주문 row 가 남지 않는다
     * - READ COMMITTED: 잠금 획득 후의 수량 합산이 직전에 커밋된 주문을 반드시 포함해야 한다
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public PendingCheckout createPendingOrder(Long userId, Long ticketId, int quantity,
                                              Long customPriceCents, Long tipCents) {
        Ticket ticket = ticketRepository.findByIdWithLockOrThrow(ticketId);
        Event event = eventRepository.findByIdOrThrow(ticket.getEventId());

        if (!event.hasPayoutAccount()) {
            throw new BusinessException(ErrorCode.PAYMENT_ACCOUNT_NOT_CONNECTED);
        }

        PriceQuote quote = PricingCalculator.calculate(ticket, quantity, customPriceCents, tipCents);
        long remaining = inventoryGuard.checkAndReserve(ticket, quantity);

        long applicationFee = paymentProperties.applicationFeeFor(quote.totalCents());
        Order order = orderRepository.save(Order.create(userId, ticket, quote, applicationFee));

        log.info("Pending order created: orderId={}, ticketId={}, quantity={}, total={}, remaining={}",
            order.getId(), ticketId, quantity, order.getTotalCents(), remaining);
        return new PendingCheckout(order, ticket.getTitle(), event.getPayoutAccountId());
    }

    /**
     * Step 3: 결제 세션 정보 부착 (트랜잭션)
     */
    @Transactional
    public void attachCheckoutSession(Long orderId, CheckoutSession session) {
        orderRepository.attachCheckoutSession(
            orderId,
            session.sessionId(),
            session.paymentReference(),
            LocalDateTime.now(clock)
        );
        log.debug("Checkout session attached: orderId={}, sessionId={}", orderId, session.sessionId());
    }
}
