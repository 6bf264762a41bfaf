package com.yunhwan.catalog.testsupport.stub;

import com.yunhwan.catalog.common.exception.EventPersistenceException;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.usecase.event.port.EventRecordStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * event_store 테이블 대역. (aggregate_id, version) 유니크 제약과 saveAll 원자성을 흉내낸다.
 */
public class InMemoryEventRecordStore implements EventRecordStore {

    private final List<DomainEvent> events = new ArrayList<>();
    private final AtomicBoolean failNext = new AtomicBoolean(false);

    public void failNextWrite() {
        failNext.set(true);
    }

    public synchronized List<DomainEvent> all() {
        return List.copyOf(events);
    }

    public synchronized int size() {
        return events.size();
    }

    @Override
    public synchronized DomainEvent save(DomainEvent event) {
        saveAll(List.of(event));
        return event;
    }

    @Override
    public synchronized List<DomainEvent> saveAll(List<DomainEvent> batch) {
        if (failNext.getAndSet(false)) {
            throw new IllegalStateException("injected write failure");
        }
        List<DomainEvent> staged = new ArrayList<>(events);
        for (DomainEvent e : batch) {
            boolean conflict = staged.stream().anyMatch(x ->
                    x.aggregateId().equals(e.aggregateId()) && x.version() == e.version());
            if (conflict) {
                throw new EventPersistenceException(
                        "duplicate version. aggregateId=" + e.aggregateId() + ", version=" + e.version());
            }
            staged.add(e);
        }
        events.clear();
        events.addAll(staged);
        return batch;
    }

    @Override
    public synchronized List<DomainEvent> findByAggregateId(String aggregateId) {
        return events.stream()
                .filter(e -> e.aggregateId().equals(aggregateId))
                .sorted(Comparator.comparingInt(DomainEvent::version))
                .toList();
    }

    @Override
    public synchronized List<DomainEvent> findByAggregateIdAndEventType(String aggregateId, String eventType) {
        return events.stream()
                .filter(e -> e.aggregateId().equals(aggregateId) && e.eventType().equals(eventType))
                .sorted(Comparator.comparingInt(DomainEvent::version))
                .toList();
    }

    @Override
    public synchronized int findLatestVersion(String aggregateId) {
        return events.stream()
                .filter(e -> e.aggregateId().equals(aggregateId))
                .mapToInt(DomainEvent::version)
                .max()
                .orElse(0);
    }
}
