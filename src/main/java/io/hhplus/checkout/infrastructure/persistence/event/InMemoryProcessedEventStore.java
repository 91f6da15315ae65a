package io.hhplus.checkout.infrastructure.persistence.event;

import io.hhplus.checkout.domain.event.ProcessedEventStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * InMemory 이벤트 멱등성 기록
 *
 * 만료된 항목은 같은 키로 다시 기록할 때 덮어쓴다. 별도 정리 스레드는 없다.
 */
@Component
@Profile("inmemory")
public class InMemoryProcessedEventStore implements ProcessedEventStore {

    private final Map<String, Instant> expiresAtByEventId = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProcessedEventStore() {
        this(Clock.systemUTC());
    }

    InMemoryProcessedEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean markIfAbsent(String eventId, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean marked = new AtomicBoolean(false);

        expiresAtByEventId.compute(eventId, (key, expiresAt) -> {
            if (expiresAt == null || !expiresAt.isAfter(now)) {
                marked.set(true);
                return now.plus(ttl);
            }
            return expiresAt;
        });
        return marked.get();
    }

    @Override
    public void remove(String eventId) {
        expiresAtByEventId.remove(eventId);
    }
}
