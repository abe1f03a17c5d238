package io.eventasaurus.ticketing.presentation.api.checkout;

import io.eventasaurus.ticketing.application.checkout.dto.CheckoutSessionResponse;
import io.eventasaurus.ticketing.application.checkout.dto.CreateCheckoutSessionRequest;
import io.eventasaurus.ticketing.application.checkout.dto.OrderDetailResponse;
import io.eventasaurus.ticketing.application.checkout.dto.SyncOrderResponse;
import io.eventasaurus.ticketing.application.usecase.checkout.CreateCheckoutSessionUseCase;
import io.eventasaurus.ticketing.application.usecase.checkout.GetOrderUseCase;
import io.eventasaurus.ticketing.application.usecase.payment.SyncOrderPaymentUseCase;
import io.eventasaurus.ticketing.presentation.auth.AuthUser;
import io.eventasaurus.ticketing.presentation.auth.JwtTokenParser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Validated
@RestController
@RequestMapping("/checkout")
@RequiredArgsConstructor
public class CheckoutController {

    private final JwtTokenParser jwtTokenParser;
    private final CreateCheckoutSessionUseCase createCheckoutSessionUseCase;
    private final SyncOrderPaymentUseCase syncOrderPaymentUseCase;
    private final GetOrderUseCase getOrderUseCase;

    /**
     * 체크아웃 세션 생성
     * PENDING 주문을 만들고 결제 페이지 URL 을 돌려준다.
     */
    @PostMapping("/sessions")
    public ResponseEntity<CheckoutSessionResponse> createSession(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody CreateCheckoutSessionRequest request
    ) {
        AuthUser user = jwtTokenParser.requireUser(authorization);
        return ResponseEntity.ok(createCheckoutSessionUseCase.execute(user.userId(), request));
    }

    /**
     * 결제 상태 동기화 (결제 완료 페이지 폴링용)
     * 대행사 장애 시에도 200 으로 현재 상태를 돌려준다.
     */
    @PostMapping("/sync/{orderId}")
    public ResponseEntity<SyncOrderResponse> sync(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long orderId
    ) {
        AuthUser user = jwtTokenParser.requireUser(authorization);
        return ResponseEntity.ok(syncOrderPaymentUseCase.execute(orderId, user.userId()));
    }

    @GetMapping("/orders/{orderId}")
    public ResponseEntity<OrderDetailResponse> getOrder(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long orderId
    ) {
        AuthUser user = jwtTokenParser.requireUser(authorization);
        return ResponseEntity.ok(getOrderUseCase.execute(orderId, user.userId()));
    }
}
