package io.hhplus.checkout.domain.event;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 처리 실패 이벤트 기록 (수동 후속 조치용)
 *
 * 웹훅은 서명 검증 외 실패에도 200으로 응답한다 (대행사 재전송 폭주 방지).
 * 대신 실패 내용을 여기에 남기고 운영자가 확인 후 RESOLVED로 닫는다.
 *
 * 같은 eventType + eventId가 다시 실패하면 새 행을 만들지 않고 occurrenceCount만 올린다.
 */
@Entity
@Table(
    name = "failed_events",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_failed_event_type_id", columnNames = {"event_type", "event_id"})
    },
    indexes = {
        @Index(name = "idx_failed_events_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FailedEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 이벤트 타입 (예: "payment_intent.succeeded")
     */
    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    /**
     * 이벤트 고유 ID (예: "evt_123")
     */
    @Column(name = "event_id", nullable = false, length = 255)
    private String eventId;

    /**
     * 원본 페이로드
     */
    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "occurrence_count", nullable = false)
    private int occurrenceCount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FailedEventStatus status;

    @Column(name = "resolution_note", length = 500)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // ===== 생성 메서드 =====

    public static FailedEvent create(String eventType, String eventId, String payload, String errorMessage) {
        FailedEvent event = new FailedEvent();
        event.eventType = eventType;
        event.eventId = eventId;
        event.payload = payload;
        event.errorMessage = errorMessage;
        event.occurrenceCount = 1;
        event.status = FailedEventStatus.PENDING;
        event.createdAt = LocalDateTime.now();
        event.updatedAt = event.createdAt;
        return event;
    }

    // ===== 비즈니스 로직 =====

    /**
     * 같은 이벤트가 다시 실패함 (대행사 재전송)
     */
    public void recordRecurrence(String errorMessage) {
        this.occurrenceCount++;
        this.errorMessage = errorMessage;
        this.status = FailedEventStatus.PENDING;
        this.updatedAt = LocalDateTime.now();
    }

    public void resolve(String note) {
        this.status = FailedEventStatus.RESOLVED;
        this.resolutionNote = note;
        this.updatedAt = LocalDateTime.now();
    }

    // ===== Enum =====

    public enum FailedEventStatus {
        PENDING,   // 확인 필요
        RESOLVED   // 조치 완료
    }
}
