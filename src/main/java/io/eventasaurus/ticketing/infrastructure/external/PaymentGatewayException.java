package io.eventasaurus.ticketing.infrastructure.external;

import lombok.Getter;

/**
 * 결제 대행사 호출 실패 (HTTP 오류, 타임아웃, 응답 파싱 실패)
 */
@Getter
public class PaymentGatewayException extends RuntimeException {

    private final Integer statusCode;  // 응답을 받지 못한 경우 null

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public PaymentGatewayException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
