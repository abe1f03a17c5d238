package io.eventasaurus.ticketing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 결제 대행사(Stripe) 연동 설정
 * <p>
 * secretKey / webhookSecret 은 반드시 환경변수로 주입한다.
 */
@ConfigurationProperties(prefix = "ticketing.payment")
public record PaymentProperties(

    String apiBaseUrl,

    String secretKey,

    String webhookSecret,

    Duration connectTimeout,

    Duration readTimeout,

    /**
     * 웹훅 서명 타임스탬프 허용 오차
     */
    Duration signatureTolerance,

    /**
     * 체크아웃 세션 만료 시간 (expires_at = now + ttl)
     */
    Duration checkoutSessionTtl,

    String successUrl,

    String cancelUrl,

    /**
     * 플랫폼 수수료율 (%), total_cents 기준 내림
     */
    int applicationFeePercent

) {

    public long applicationFeeFor(long totalCents) {
        return totalCents * applicationFeePercent / 100;
    }
}
