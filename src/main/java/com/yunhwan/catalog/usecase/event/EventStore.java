package com.yunhwan.catalog.usecase.event;

import com.yunhwan.catalog.common.exception.EventPersistenceException;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.usecase.event.port.EventRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * append-only 이벤트 저장소 파사드.
 *
 * 순서 고정: 1) 원장에 저장 (source of truth) → 2) bus에 publish.
 * 저장 실패 = 이벤트는 없었던 것. publish 실패는 저장을 되돌리지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventStore {

    private final EventRecordStore eventRecordStore;
    private final EventBus eventBus;

    public DomainEvent append(DomainEvent event) {
        persist(List.of(event));
        publish(event);
        return event;
    }

    /**
     * 한 command가 만든 이벤트 묶음. 전부 저장된 뒤에만 순서대로 publish 한다.
     */
    public List<DomainEvent> appendAll(List<DomainEvent> events) {
        if (events.isEmpty()) return List.of();

        persist(events);
        for (DomainEvent event : events) {
            publish(event);
        }
        return events;
    }

    public List<DomainEvent> getEvents(String aggregateId) {
        return eventRecordStore.findByAggregateId(aggregateId);
    }

    public List<DomainEvent> getEvents(String aggregateId, EventType eventType) {
        if (eventType == null) {
            return getEvents(aggregateId);
        }
        return eventRecordStore.findByAggregateIdAndEventType(aggregateId, eventType.wireName());
    }

    public int currentVersion(String aggregateId) {
        return eventRecordStore.findLatestVersion(aggregateId);
    }

    public boolean exists(String aggregateId) {
        return currentVersion(aggregateId) > 0;
    }

    public Map<String, Object> replay(String aggregateId) {
        return EventApplicator.fold(getEvents(aggregateId));
    }

    private void persist(List<DomainEvent> events) {
        try {
            if (events.size() == 1) {
                eventRecordStore.save(events.get(0));
            } else {
                eventRecordStore.saveAll(events);
            }
        } catch (EventPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            DomainEvent first = events.get(0);
            throw new EventPersistenceException(
                    "event append failed. aggregateId=" + first.aggregateId()
                            + ", eventType=" + first.eventType() + ", count=" + events.size(), e);
        }
    }

    private void publish(DomainEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            // 이미 저장됨 → 되돌리지 않는다. projection은 replay/rebuild로 복구.
            log.error("[EventStore] publish failed after persist. eventId={}, eventType={}, aggregateId={}",
                    event.eventId(), event.eventType(), event.aggregateId(), e);
        }
    }
}
