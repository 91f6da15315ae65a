package io.hhplus.checkout.application.webhook;

import io.hhplus.checkout.application.webhook.dto.FailedEventResponse;
import io.hhplus.checkout.common.exception.BusinessException;
import io.hhplus.checkout.common.exception.ErrorCode;
import io.hhplus.checkout.domain.event.FailedEvent;
import io.hhplus.checkout.domain.event.FailedEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 처리 실패 이벤트 기록/조회/종료
 *
 * 같은 eventType + eventId가 다시 실패하면 기존 행의 occurrenceCount를 올린다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailedEventService {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final FailedEventRepository failedEventRepository;

    @Transactional
    public FailedEvent record(String eventType, String eventId, String payload, String errorMessage) {
        String truncatedMessage = truncate(errorMessage);

        FailedEvent failedEvent = failedEventRepository.findByEventTypeAndEventId(eventType, eventId)
            .map(existing -> {
                existing.recordRecurrence(truncatedMessage);
                return existing;
            })
            .orElseGet(() -> FailedEvent.create(eventType, eventId, payload, truncatedMessage));

        FailedEvent saved = failedEventRepository.save(failedEvent);
        log.warn("Failed event recorded: eventType={}, eventId={}, occurrenceCount={}, error={}",
            eventType, eventId, saved.getOccurrenceCount(), truncatedMessage);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<FailedEventResponse> getPendingEvents() {
        return failedEventRepository.findByStatusOrderByIdAsc(FailedEvent.FailedEventStatus.PENDING).stream()
            .map(FailedEventResponse::from)
            .toList();
    }

    @Transactional
    public FailedEventResponse resolve(Long failedEventId, String note) {
        FailedEvent failedEvent = failedEventRepository.findById(failedEventId)
            .orElseThrow(() -> new BusinessException(
                ErrorCode.FAILED_EVENT_NOT_FOUND,
                "실패 이벤트를 찾을 수 없습니다. failedEventId: " + failedEventId
            ));

        failedEvent.resolve(note);
        FailedEvent saved = failedEventRepository.save(failedEvent);

        log.info("Failed event resolved: id={}, eventType={}, eventId={}", saved.getId(), saved.getEventType(), saved.getEventId());
        return FailedEventResponse.from(saved);
    }

    private String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
    }
}
