package io.eventasaurus.ticketing.application.usecase.payment;

import io.eventasaurus.ticketing.application.checkout.ConfirmationResult;
import io.eventasaurus.ticketing.application.checkout.ConfirmationSource;
import io.eventasaurus.ticketing.application.checkout.OrderConfirmationService;
import io.eventasaurus.ticketing.application.checkout.dto.SyncOrderResponse;
import io.eventasaurus.ticketing.application.usecase.UseCase;
import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSessionStatus;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayClient;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayException;
import io.eventasaurus.ticketing.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 결제 상태 동기화 (웹훅 보조 경로)
 * <p>
 * 1. 주문 소유자 확인 (404 / 403)
 * 2. payment_reference 가 있으면 payment intent, 없으면 checkout session 조회
 * 3. succeeded / paid 이면 confirm (synthetic event id: sync_...)
 * <p>
 * 대행사 장애는 호출자에게 노출하지 않는다. 로그만 남기고 DB 의 현재 상태를 돌려준다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class SyncOrderPaymentUseCase {

    private final OrderRepository orderRepository;
    private final PaymentGatewayClient paymentGatewayClient;
    private final OrderConfirmationService confirmationService;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    public SyncOrderResponse execute(Long orderId, Long userId) {
        Order order = orderRepository.findByIdOrThrow(orderId);
        if (!order.isOwnedBy(userId)) {
            log.warn("Sync denied: orderId={}, requestedBy={}", orderId, userId);
            throw new BusinessException(ErrorCode.ORDER_ACCESS_DENIED);
        }

        if (order.isConfirmed()) {
            metricsCollector.recordSync("already_confirmed");
            return SyncOrderResponse.of(order.getId(), order.getStatus());
        }

        boolean paid;
        try {
            paid = isPaidAtProvider(order);
        } catch (PaymentGatewayException e) {
            log.error("Payment provider unavailable during sync, returning stored status: orderId={}, status={}",
                orderId, e.getStatusCode(), e);
            metricsCollector.recordSync("provider_error");
            return SyncOrderResponse.of(order.getId(), order.getStatus());
        }

        if (!paid) {
            metricsCollector.recordSync("pending");
            return SyncOrderResponse.of(order.getId(), order.getStatus());
        }

        ConfirmationResult result = confirmationService.confirm(order, syntheticEventId(), ConfirmationSource.SYNC);
        metricsCollector.recordSync(result.transitioned() ? "confirmed" : "already_confirmed");
        return SyncOrderResponse.of(order.getId(), result.status());
    }

    private boolean isPaidAtProvider(Order order) {
        if (order.hasPaymentReference()) {
            return paymentGatewayClient.getPaymentIntent(order.getPaymentReference()).isSucceeded();
        }

        if (order.hasCheckoutSession()) {
            CheckoutSessionStatus session = paymentGatewayClient.getCheckoutSession(order.getStripeSessionId());
            if (session.paymentIntentId() != null) {
                orderRepository.attachPaymentReferenceIfAbsent(
                    order.getId(), session.paymentIntentId(), LocalDateTime.now(clock));
            }
            return session.isPaid();
        }

        // 세션 생성 전 실패한 주문: 조회할 대상이 없다
        log.info("Sync skipped, order has no payment session: orderId={}", order.getId());
        return false;
    }

    private static String syntheticEventId() {
        return "sync_" + UUID.randomUUID();
    }
}
