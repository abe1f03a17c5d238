package io.eventasaurus.ticketing.application.checkout.listener;

import io.eventasaurus.ticketing.domain.order.OrderConfirmedEvent;
import io.eventasaurus.ticketing.infrastructure.kafka.message.OrderConfirmedMessage;
import io.eventasaurus.ticketing.infrastructure.kafka.producer.OrderEventProducer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 확정 후속 처리
 * <p>
 * AFTER_COMMIT: 확정 트랜잭션이 커밋된 뒤에만 실행된다 (롤백 시 발행 안 됨).
 * 영수증/알림 소비자는 order-confirmed 토픽을 구독한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderConfirmedEventListener {

    private final OrderEventProducer orderEventProducer;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderConfirmed(OrderConfirmedEvent event) {
        log.debug("Forwarding order confirmation: orderId={}, eventId={}", event.orderId(), event.confirmationEventId());
        orderEventProducer.publishOrderConfirmed(OrderConfirmedMessage.from(event));
    }
}
