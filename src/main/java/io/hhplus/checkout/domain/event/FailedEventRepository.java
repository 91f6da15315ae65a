package io.hhplus.checkout.domain.event;

import java.util.List;
import java.util.Optional;

/**
 * 처리 실패 이벤트 저장소
 */
public interface FailedEventRepository {

    FailedEvent save(FailedEvent failedEvent);

    Optional<FailedEvent> findById(Long id);

    Optional<FailedEvent> findByEventTypeAndEventId(String eventType, String eventId);

    /**
     * 상태별 목록 (오래된 순)
     */
    List<FailedEvent> findByStatusOrderByIdAsc(FailedEvent.FailedEventStatus status);
}
