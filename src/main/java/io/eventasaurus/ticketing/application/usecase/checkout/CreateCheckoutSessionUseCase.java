package io.eventasaurus.ticketing.application.usecase.checkout;

import io.eventasaurus.ticketing.application.checkout.CheckoutTransactionService;
import io.eventasaurus.ticketing.application.checkout.PendingCheckout;
import io.eventasaurus.ticketing.application.checkout.dto.CheckoutSessionResponse;
import io.eventasaurus.ticketing.application.checkout.dto.CreateCheckoutSessionRequest;
import io.eventasaurus.ticketing.application.usecase.UseCase;
import io.eventasaurus.ticketing.common.exception.BusinessException;
import io.eventasaurus.ticketing.common.exception.ErrorCode;
import io.eventasaurus.ticketing.config.PaymentProperties;
import io.eventasaurus.ticketing.domain.order.Order;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSession;
import io.eventasaurus.ticketing.infrastructure.external.CheckoutSessionRequest;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayClient;
import io.eventasaurus.ticketing.infrastructure.external.PaymentGatewayException;
import io.eventasaurus.ticketing.infrastructure.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 체크아웃 세션 생성 UseCase
 * <p>
 * 흐름:
 * <pre>
 * 1. createPendingOrder()    : 티켓 잠금 → 가격 계산 → 재고 검증 → PENDING 주문 INSERT (트랜잭션)
 * 2. createCheckoutSession() : 결제 대행사 세션 생성 (트랜잭션 밖, 타임아웃 있음)
 * 3. attachCheckoutSession() : session id / payment reference 부착 (트랜잭션)
 * </pre>
 * 2단계 실패 시 주문은 PENDING 으로 남는다. 재고를 점유한 채 남지만
 * 별도 만료 정리는 하지 않는다.
 */
@Slf4j
@UseCase
@RequiredArgsConstructor
public class CreateCheckoutSessionUseCase {

    private final CheckoutTransactionService transactionService;
    private final PaymentGatewayClient paymentGatewayClient;
    private final PaymentProperties paymentProperties;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    public CheckoutSessionResponse execute(Long userId, CreateCheckoutSessionRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("Checkout requested: userId={}, ticketId={}, quantity={}",
            userId, request.ticketId(), request.quantityOrDefault());

        try {
            // Step 1: PENDING 주문 (트랜잭션)
            PendingCheckout pending = transactionService.createPendingOrder(
                userId,
                request.ticketId(),
                request.quantityOrDefault(),
                request.customPriceCents(),
                request.tipCents()
            );
            Order order = pending.order();

            // Step 2: 외부 결제 API (트랜잭션 밖)
            CheckoutSession session = createSession(pending);

            // Step 3: 세션 부착 (트랜잭션)
            transactionService.attachCheckoutSession(order.getId(), session);

            metricsCollector.recordCheckoutSuccess();
            log.info("Checkout session ready: orderId={}, sessionId={}", order.getId(), session.sessionId());
            return CheckoutSessionResponse.of(order.getId(), session.sessionId(), session.checkoutUrl());

        } catch (BusinessException e) {
            metricsCollector.recordCheckoutFailure();
            if (isInventoryRejection(e.getErrorCode())) {
                metricsCollector.recordInventoryRejection(e.getErrorCode().name().toLowerCase());
            }
            throw e;
        } finally {
            metricsCollector.recordCheckoutDuration(startTime);
        }
    }

    private CheckoutSession createSession(PendingCheckout pending) {
        Order order = pending.order();
        try {
            return paymentGatewayClient.createCheckoutSession(buildSessionRequest(pending));
        } catch (PaymentGatewayException e) {
            log.error("Payment session creation failed, order left pending: orderId={}, status={}",
                order.getId(), e.getStatusCode(), e);
            throw new BusinessException(ErrorCode.PAYMENT_SESSION_FAILED, e);
        }
    }

    private CheckoutSessionRequest buildSessionRequest(PendingCheckout pending) {
        Order order = pending.order();

        List<CheckoutSessionRequest.LineItem> lineItems = new ArrayList<>();
        lineItems.add(new CheckoutSessionRequest.LineItem(
            pending.ticketTitle(),
            order.getPricingSnapshot().getUnitPriceCents(),
            order.getQuantity()
        ));
        if (order.getTipCents() > 0) {
            lineItems.add(new CheckoutSessionRequest.LineItem("Tip", order.getTipCents(), 1));
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("order_id", String.valueOf(order.getId()));
        metadata.put("ticket_id", String.valueOf(order.getTicketId()));
        metadata.put("event_id", String.valueOf(order.getEventId()));
        metadata.put("user_id", String.valueOf(order.getUserId()));
        metadata.put("pricing_model", order.getPricingSnapshot().getPricingModel().name().toLowerCase());

        return new CheckoutSessionRequest(
            order.getId(),
            order.getCurrency(),
            lineItems,
            order.getApplicationFeeCents(),
            pending.payoutAccountId(),
            "checkout_order_" + order.getId(),
            clock.instant().plus(paymentProperties.checkoutSessionTtl()),
            metadata
        );
    }

    private static boolean isInventoryRejection(ErrorCode errorCode) {
        return errorCode == ErrorCode.TICKET_SOLD_OUT
            || errorCode == ErrorCode.PER_ORDER_LIMIT_EXCEEDED
            || errorCode == ErrorCode.SALE_NOT_ACTIVE;
    }
}
