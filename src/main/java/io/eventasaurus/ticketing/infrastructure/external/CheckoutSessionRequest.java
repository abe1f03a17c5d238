package io.eventasaurus.ticketing.infrastructure.external;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 체크아웃 세션 생성 요청
 *
 * @param idempotencyKey   같은 주문으로 재요청 시 대행사가 같은 세션을 돌려주도록 하는 키
 * @param payoutAccountId  주최자 정산 계정 (transfer_data.destination)
 */
public record CheckoutSessionRequest(
    Long orderId,
    String currency,
    List<LineItem> lineItems,
    long applicationFeeCents,
    String payoutAccountId,
    String idempotencyKey,
    Instant expiresAt,
    Map<String, String> metadata
) {

    public record LineItem(String name, long unitAmountCents, int quantity) {
    }

    public long totalCents() {
        return lineItems.stream()
            .mapToLong(item -> item.unitAmountCents() * item.quantity())
            .sum();
    }
}
