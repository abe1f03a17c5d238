package io.eventasaurus.ticketing.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 체크아웃 / 결제 정합성 메트릭
 *
 * 수집 메트릭:
 * - checkout_total: 체크아웃 세션 생성 성공/실패
 * - checkout_duration_seconds: 체크아웃 처리 시간 (P50, P95, P99)
 * - inventory_rejections_total: 재고 검증 거절 (reason 태그)
 * - webhook_events_total: 웹훅 처리 결과 (type, outcome 태그)
 * - order_sync_total: sync 결과 (outcome 태그)
 * - order_confirmations_total: 실제 확정 전이 (source 태그: webhook / sync)
 */
@Component
public class MetricsCollector {

    private final MeterRegistry meterRegistry;

    private final Counter checkoutSuccessCounter;
    private final Counter checkoutFailureCounter;
    private final Timer checkoutDurationTimer;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.checkoutSuccessCounter = Counter.builder("checkout_total")
                .tag("status", "success")
                .description("Total number of checkout sessions created")
                .register(meterRegistry);

        this.checkoutFailureCounter = Counter.builder("checkout_total")
                .tag("status", "failure")
                .description("Total number of failed checkout attempts")
                .register(meterRegistry);

        this.checkoutDurationTimer = Timer.builder("checkout_duration_seconds")
                .description("Checkout processing duration")
                .publishPercentiles(0.5, 0.95, 0.99)  // P50, P95, P99
                .register(meterRegistry);
    }

    // ============================================================
    // 체크아웃
    // ============================================================

    public void recordCheckoutSuccess() {
        checkoutSuccessCounter.increment();
    }

    public void recordCheckoutFailure() {
        checkoutFailureCounter.increment();
    }

    public void recordCheckoutDuration(long startTimeMs) {
        long duration = System.currentTimeMillis() - startTimeMs;
        checkoutDurationTimer.record(duration, TimeUnit.MILLISECONDS);
    }

    public void recordInventoryRejection(String reason) {
        Counter.builder("inventory_rejections_total")
                .tag("reason", reason)
                .description("Checkout attempts rejected by the inventory guard")
                .register(meterRegistry)
                .increment();
    }

    // ============================================================
    // 웹훅 / 싱크 / 확정
    // ============================================================

    public void recordWebhookEvent(String type, String outcome) {
        Counter.builder("webhook_events_total")
                .tag("type", type)
                .tag("outcome", outcome)
                .description("Payment provider webhook events by outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordSync(String outcome) {
        Counter.builder("order_sync_total")
                .tag("outcome", outcome)
                .description("Order payment sync requests by outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordConfirmation(String source) {
        Counter.builder("order_confirmations_total")
                .tag("source", source)
                .description("Orders transitioned from pending to confirmed")
                .register(meterRegistry)
                .increment();
    }
}
