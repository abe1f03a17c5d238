package io.eventasaurus.ticketing.application.checkout;

import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderConfirmedEvent;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 주문 확정 (PENDING → CONFIRMED)
 * <p>
 * 주문 상태를 바꾸는 유일한 경로. 웹훅과 sync 모두 이 메서드를 호출한다.
 * <p>
 * 동시성: {@code UPDATE ... WHERE id = ? AND status = 'PENDING'} 의 affected row 로 승자를 정한다.
 * 같은 주문에 대해 몇 번, 몇 개의 스레드가 호출하든 전이와 confirmed_at 기록은 한 번뿐이다.
 * <p>
 * 전이에 성공한 경우에만 OrderConfirmedEvent 를 발행하며,
 * 후속 처리(Kafka 발행)는 커밋 이후 OrderConfirmedEventListener 에서 수행된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderConfirmationService {

    private final OrderRepository orderRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    @Transactional
    public ConfirmationResult confirm(Order order, String confirmationEventId, ConfirmationSource source) {
        if (order.isConfirmed()) {
            log.debug("이미 확정된 주문: orderId={}, eventId={}", order.getId(), confirmationEventId);
            return ConfirmationResult.unchanged(order.getId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        int updated = orderRepository.confirmIfPending(order.getId(), now, confirmationEventId);

        if (updated == 0) {
            // 다른 웹훅/싱크가 먼저 확정
            log.info("Order already confirmed by a concurrent caller: orderId={}, eventId={}",
                order.getId(), confirmationEventId);
            return ConfirmationResult.unchanged(order.getId());
        }

        eventPublisher.publishEvent(OrderConfirmedEvent.of(order, confirmationEventId, now));
        metricsCollector.recordConfirmation(source.tag());
        log.info("Order confirmed: orderId={}, eventId={}, source={}", order.getId(), confirmationEventId, source);
        return ConfirmationResult.transitioned(order.getId());
    }
}
