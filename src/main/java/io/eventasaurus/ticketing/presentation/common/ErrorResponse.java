package io.eventasaurus.ticketing.presentation.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 오류 응답 본문: {"error": "...", "code": "..."}
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

    private final String error;
    private final String code;

    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(message, code);
    }
}
