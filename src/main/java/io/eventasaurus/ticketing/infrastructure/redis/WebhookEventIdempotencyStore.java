package io.eventasaurus.ticketing.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 웹훅 이벤트 중복 수신 방지
 * <p>
 * 대행사는 at-least-once 로 같은 이벤트를 재전송한다. 처리한 이벤트 id 를 SET NX 로 기록해
 * 재전송은 DB 조회 없이 건너뛴다.
 * <p>
 * 이 저장소는 최적화 계층이다. 정합성은 주문 확정의 조건부 UPDATE 가 보장하므로
 * Redis 장애 시에는 "처음 본 이벤트"로 간주하고 처리를 계속한다.
 * <p>
 * TTL: 24시간 (대행사 재전송 주기보다 길게)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookEventIdempotencyStore {

    private static final String KEY_PREFIX = "webhook:processed:";
    private static final Duration TTL = Duration.ofHours(24);

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * 처음 보는 이벤트면 기록하고 true
     *
     * @return 이미 기록된 이벤트면 false
     */
    public boolean markIfFirstSeen(String eventId) {
        try {
            Boolean first = redisTemplate.opsForValue().setIfAbsent(buildKey(eventId), "1", TTL);
            if (Boolean.FALSE.equals(first)) {
                log.info("웹훅 이벤트 중복 수신: eventId={}", eventId);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            log.warn("웹훅 중복 체크 실패, 처리 계속 진행: eventId={}, error={}", eventId, e.getMessage());
            return true;
        }
    }

    /**
     * 처리 중 예외가 난 이벤트는 기록을 지워 재전송 시 다시 처리되게 한다.
     */
    public void release(String eventId) {
        try {
            redisTemplate.delete(buildKey(eventId));
        } catch (DataAccessException e) {
            log.warn("웹훅 중복 기록 삭제 실패: eventId={}, error={}", eventId, e.getMessage());
        }
    }

    private String buildKey(String eventId) {
        return KEY_PREFIX + eventId;
    }
}
