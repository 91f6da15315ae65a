package io.hhplus.checkout.infrastructure.persistence.event;

import io.hhplus.checkout.domain.event.FailedEvent;
import io.hhplus.checkout.domain.event.FailedEvent.FailedEventStatus;
import io.hhplus.checkout.domain.event.FailedEventRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@Primary
public interface JpaFailedEventRepository extends JpaRepository<FailedEvent, Long>, FailedEventRepository {

    @Override
    FailedEvent save(FailedEvent failedEvent);

    @Override
    Optional<FailedEvent> findById(Long id);

    @Override
    Optional<FailedEvent> findByEventTypeAndEventId(String eventType, String eventId);

    @Override
    List<FailedEvent> findByStatusOrderByIdAsc(FailedEventStatus status);
}
