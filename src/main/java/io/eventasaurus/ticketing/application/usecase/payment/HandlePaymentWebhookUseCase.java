package io.eventasaurus.ticketing.application.usecase.payment;

import io.eventasaurus.ticketing.application.checkout.ConfirmationResult;
import io.eventasaurus.ticketing.application.checkout.ConfirmationSource;
import io.eventasaurus.ticketing.application.checkout.OrderConfirmationService;
import io.eventasaurus.ticketing.application.usecase.UseCase;
import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.config.PaymentProperties;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.domain.order.OrderRepository;
import io.eventasaurus.ticketing.infrastructure.external.InvalidWebhookSignatureException;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayClient;
import io.eventasaurus.ticketing.infrastructure.external.PaymentWebhookEvent;
import io.eventasaurus.ticketing.infrastructure.metrics.MetricsCollector;
import io.eventasaurus.ticketing.infrastructure.redis.WebhookEventIdempotencyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 결제 대행사 웹훅 처리 UseCase
 * <p>
 * 1. 서명 검증: 실패 시 INVALID_SIGNATURE (400), 주문 조회/변경 없음
 * 2. 이벤트 id 중복 체크 (Redis SET NX)
 * 3. 이벤트 타입별 분기
 * <pre>
 * PAYMENT_SUCCEEDED              : payment_reference 로 주문 조회 → confirm
 * SESSION_COMPLETED (paid)       : session id 로 주문 조회 → payment_reference 보강 → confirm
 * PAYMENT_FAILED / SESSION_EXPIRED: 주문은 PENDING 유지 (재시도 가능)
 * UNHANDLED                      : 무시
 * </pre>
 * 주문을 찾지 못해도 성공으로 응답한다. 대행사 재전송을 유발하지 않기 위함.
 * DB 오류 등 예상하지 못한 예외는 그대로 전파되어 500 이 되고, 대행사가 재전송한다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class HandlePaymentWebhookUseCase {

    private final PaymentGatewayClient paymentGatewayClient;
    private final PaymentProperties paymentProperties;
    private final OrderRepository orderRepository;
    private final OrderConfirmationService confirmationService;
    private final WebhookEventIdempotencyStore idempotencyStore;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    public WebhookOutcome execute(String payload, String signatureHeader) {
        PaymentWebhookEvent event = verify(payload, signatureHeader);

        if (!idempotencyStore.markIfFirstSeen(event.id())) {
            metricsCollector.recordWebhookEvent(event.type().name().toLowerCase(), WebhookOutcome.DUPLICATE.tag());
            return WebhookOutcome.DUPLICATE;
        }

        WebhookOutcome outcome;
        try {
            outcome = dispatch(event);
        } catch (RuntimeException e) {
            // 재전송 시 다시 처리되도록 중복 기록 해제
            idempotencyStore.release(event.id());
            throw e;
        }

        metricsCollector.recordWebhookEvent(event.type().name().toLowerCase(), outcome.tag());
        return outcome;
    }

    private PaymentWebhookEvent verify(String payload, String signatureHeader) {
        try {
            return paymentGatewayClient.verifyWebhookSignature(
                payload, signatureHeader, paymentProperties.webhookSecret());
        } catch (InvalidWebhookSignatureException e) {
            log.warn("Webhook signature rejected: {}", e.getMessage());
            metricsCollector.recordWebhookEvent("unknown", "invalid_signature");
            throw new BusinessException(ErrorCode.INVALID_SIGNATURE);
        }
    }

    private WebhookOutcome dispatch(PaymentWebhookEvent event) {
        log.info("Webhook received: eventId={}, type={}, objectId={}", event.id(), event.rawType(), event.objectId());

        return switch (event.type()) {
            case PAYMENT_SUCCEEDED -> onPaymentSucceeded(event);
            case SESSION_COMPLETED -> onSessionCompleted(event);
            case PAYMENT_FAILED -> leavePending(event, orderRepository.findByPaymentReference(event.objectId()));
            case SESSION_EXPIRED -> leavePending(event, orderRepository.findByStripeSessionId(event.objectId()));
            case UNHANDLED -> {
                log.debug("Unhandled webhook type ignored: eventId={}, type={}", event.id(), event.rawType());
                yield WebhookOutcome.UNHANDLED;
            }
        };
    }

    private WebhookOutcome onPaymentSucceeded(PaymentWebhookEvent event) {
        Optional<Order> order = orderRepository.findByPaymentReference(event.objectId());
        if (order.isEmpty()) {
            log.warn("Order not found for payment intent: eventId={}, paymentReference={}",
                event.id(), event.objectId());
            return WebhookOutcome.ORDER_NOT_FOUND;
        }
        return confirm(order.get(), event);
    }

    private WebhookOutcome onSessionCompleted(PaymentWebhookEvent event) {
        Optional<Order> found = orderRepository.findByStripeSessionId(event.objectId());
        if (found.isEmpty()) {
            log.warn("Order not found for checkout session: eventId={}, sessionId={}",
                event.id(), event.objectId());
            return WebhookOutcome.ORDER_NOT_FOUND;
        }

        Order order = found.get();
        if (event.paymentIntentId() != null) {
            orderRepository.attachPaymentReferenceIfAbsent(order.getId(), event.paymentIntentId(), LocalDateTime.now(clock));
        }

        if (!event.isPaid()) {
            // 지연 결제 수단: payment_intent.succeeded 또는 sync 로 확정된다
            log.info("Checkout session completed without payment: orderId={}, paymentStatus={}",
                order.getId(), event.paymentStatus());
            return WebhookOutcome.LEFT_PENDING;
        }
        return confirm(order, event);
    }

    private WebhookOutcome leavePending(PaymentWebhookEvent event, Optional<Order> order) {
        if (order.isEmpty()) {
            log.warn("Order not found for {}: eventId={}, objectId={}", event.rawType(), event.id(), event.objectId());
            return WebhookOutcome.ORDER_NOT_FOUND;
        }
        log.info("Payment not completed, order stays {}: orderId={}, type={}",
            order.get().getStatus(), order.get().getId(), event.rawType());
        return WebhookOutcome.LEFT_PENDING;
    }

    private WebhookOutcome confirm(Order order, PaymentWebhookEvent event) {
        ConfirmationResult result = confirmationService.confirm(order, event.id(), ConfirmationSource.WEBHOOK);
        return result.transitioned() ? WebhookOutcome.CONFIRMED : WebhookOutcome.ALREADY_CONFIRMED;
    }
}
