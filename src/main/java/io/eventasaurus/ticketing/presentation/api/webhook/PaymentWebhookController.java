package io.eventasaurus.ticketing.presentation.api.webhook;

import io.eventasaurus.ticketing.application.usecase.payment.HandlePaymentWebhookUseCase;
import io.eventasaurus.ticketing.application.usecase.payment.WebhookOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 결제 대행사 웹훅 엔드포인트
 * <p>
 * 서명 검증을 위해 본문을 원문 String 으로 받는다 (JSON 바인딩 금지).
 * 서명 실패만 400, 그 외 인식된 모든 결과는 200 {"received": true}.
 */
@Slf4j
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final HandlePaymentWebhookUseCase handlePaymentWebhookUseCase;

    @PostMapping("/provider")
    public ResponseEntity<Map<String, Object>> receive(
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String payload
    ) {
        WebhookOutcome outcome = handlePaymentWebhookUseCase.execute(payload, signature);
        log.debug("Webhook handled: outcome={}", outcome);
        return ResponseEntity.ok(Map.of("received", true));
    }
}
