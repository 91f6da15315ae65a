package io.hhplus.checkout.application.webhook.dto;

import io.hhplus.checkout.domain.event.FailedEvent;

import java.time.LocalDateTime;

public record FailedEventResponse(
    Long id,
    String eventType,
    String eventId,
    String errorMessage,
    int occurrenceCount,
    FailedEvent.FailedEventStatus status,
    String resolutionNote,
    LocalDateTime createdAt,
    LocalDateTime updatedAt
) {
    public static FailedEventResponse from(FailedEvent event) {
        return new FailedEventResponse(
            event.getId(),
            event.getEventType(),
            event.getEventId(),
            event.getErrorMessage(),
            event.getOccurrenceCount(),
            event.getStatus(),
            event.getResolutionNote(),
            event.getCreatedAt(),
            event.getUpdatedAt()
        );
    }
}
