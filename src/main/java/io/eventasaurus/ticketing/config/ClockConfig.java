package io.eventasaurus.ticketing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 판매 기간 / 웹훅 타임스탬프 / confirmed_at 계산에 쓰는 시계.
 * 테스트에서는 Clock.fixed 로 교체한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
