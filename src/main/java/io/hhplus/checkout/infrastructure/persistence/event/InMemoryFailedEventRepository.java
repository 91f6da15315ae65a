package io.hhplus.checkout.infrastructure.persistence.event;

import io.hhplus.checkout.domain.event.FailedEvent;
import io.hhplus.checkout.domain.event.FailedEvent.FailedEventStatus;
import io.hhplus.checkout.domain.event.FailedEventRepository;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@Profile("inmemory")
public class InMemoryFailedEventRepository implements FailedEventRepository {

    private final Map<Long, FailedEvent> storage = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    @Override
    public FailedEvent save(FailedEvent failedEvent) {
        if (failedEvent.getId() == null) {
            Long newId = idGenerator.getAndIncrement();
            try {
                var idField = FailedEvent.class.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(failedEvent, newId);
            } catch (Exception e) {
                throw new RuntimeException("Failed to set ID", e);
            }
        }
        storage.put(failedEvent.getId(), failedEvent);
        return failedEvent;
    }

    @Override
    public Optional<FailedEvent> findById(Long id) {
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public Optional<FailedEvent> findByEventTypeAndEventId(String eventType, String eventId) {
        return storage.values().stream()
            .filter(event -> event.getEventType().equals(eventType) && event.getEventId().equals(eventId))
            .findFirst();
    }

    @Override
    public List<FailedEvent> findByStatusOrderByIdAsc(FailedEventStatus status) {
        return storage.values().stream()
            .filter(event -> event.getStatus() == status)
            .sorted(Comparator.comparing(FailedEvent::getId))
            .toList();
    }

    public void clear() {
        storage.clear();
        idGenerator.set(1);
    }
}
