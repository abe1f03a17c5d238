package io.eventasaurus.ticketing.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 * <p>
 * message는 클라이언트에 그대로 노출되는 문구이므로 영문으로 유지한다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // ====================================
    // 티켓/이벤트 관련 (T)
    // ====================================
    TICKET_NOT_FOUND("T001", "Ticket not found"),
    EVENT_NOT_FOUND("T002", "Event not found"),

    // ====================================
    // 재고 관련 (INV)
    // ====================================
    TICKET_SOLD_OUT("INV001", "Ticket is no longer available"),
    PER_ORDER_LIMIT_EXCEEDED("INV002", "Quantity exceeds the per-order limit"),
    SALE_NOT_ACTIVE("INV003", "Ticket is not on sale"),

    // ====================================
    // 가격 관련 (PR)
    // ====================================
    PRICE_BELOW_MINIMUM("PR001", "Price is below minimum required amount"),
    CUSTOM_PRICE_REQUIRED("PR002", "Custom price is required for flexible pricing"),
    CUSTOM_PRICE_NOT_ALLOWED("PR003", "Custom price is not allowed for fixed price tickets"),
    TIP_NOT_ALLOWED("PR004", "Tips are not accepted for this ticket"),

    // ====================================
    // 주문 관련 (O)
    // ====================================
    INVALID_QUANTITY("O001", "Quantity must be at least 1"),
    ORDER_NOT_FOUND("O002", "Order not found"),
    ORDER_ACCESS_DENIED("O003", "Access denied"),

    // ====================================
    // 결제 관련 (PAY)
    // ====================================
    PAYMENT_ACCOUNT_NOT_CONNECTED("PAY001", "Event organizer has not connected a payment account"),
    PAYMENT_SESSION_FAILED("PAY002", "Could not start payment"),
    INVALID_SIGNATURE("PAY003", "Invalid signature format"),

    // ====================================
    // 공통 (COMMON)
    // ====================================
    UNAUTHENTICATED("COMMON001", "Authentication required"),
    INVALID_INPUT("COMMON002", "Invalid input"),
    INTERNAL_SERVER_ERROR("COMMON003", "Internal server error");

    private final String code;
    private final String message;
}
