package io.hhplus.checkout.domain.event;

import java.time.Duration;

/**
 * 처리한 외부 이벤트 ID 기록 (중복 처리 방지 창)
 *
 * 구현:
 * - RedisProcessedEventStore: SET NX + TTL
 * - InMemoryProcessedEventStore: 만료 시각을 가진 맵 (inmemory 프로필, 단위 테스트)
 */
public interface ProcessedEventStore {

    /**
     * 처음 보는 이벤트면 기록하고 true, 이미 기록되어 있으면 false
     */
    boolean markIfAbsent(String eventId, Duration ttl);

    /**
     * 처리 실패 시 기록을 지워 재전송을 다시 받을 수 있게 한다
     */
    void remove(String eventId);
}
