package io.hhplus.checkout.infrastructure.redis;

import io.hhplus.checkout.domain.event.ProcessedEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 웹훅 이벤트 멱등성 기록 (Redis)
 *
 * 키 형식: webhook:processed:{eventId}
 * SET NX로 기록하므로 동시에 같은 이벤트가 들어와도 한 요청만 true를 받는다.
 * 명령 타임아웃은 spring.data.redis.timeout으로 제한된다.
 */
@Slf4j
@Component
@Profile("!inmemory")
@RequiredArgsConstructor
public class RedisProcessedEventStore implements ProcessedEventStore {

    private static final String KEY_PREFIX = "webhook:processed:";

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean markIfAbsent(String eventId, Duration ttl) {
        Boolean success = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + eventId, "1", ttl);

        if (Boolean.TRUE.equals(success)) {
            log.debug("웹훅 이벤트 처리 기록: eventId={}", eventId);
            return true;
        }
        log.info("웹훅 이벤트 중복 수신: eventId={}", eventId);
        return false;
    }

    @Override
    public void remove(String eventId) {
        redisTemplate.delete(KEY_PREFIX + eventId);
    }
}
