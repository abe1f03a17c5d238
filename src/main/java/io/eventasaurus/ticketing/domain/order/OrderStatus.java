package io.eventasaurus.ticketing.domain.order;

import java.util.List;

/**
 * 주문 상태
 * <p>
 * PENDING → CONFIRMED 단방향 전이만 존재한다.
 * 결제 실패/세션 만료는 별도 상태 없이 PENDING 으로 남아 재시도 가능하다.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED;

    /**
     * 재고를 점유하는 상태 목록
     */
    public static List<OrderStatus> holdingInventory() {
        return List.of(PENDING, CONFIRMED);
    }

    public String value() {
        return name().toLowerCase();
    }
}
