package com.yunhwan.catalog.infra.persistence.adapter;

import com.yunhwan.catalog.common.exception.EventPersistenceException;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.infra.persistence.entity.StoredEvent;
import com.yunhwan.catalog.infra.persistence.jpa.StoredEventJpaRepository;
import com.yunhwan.catalog.infra.serialization.JacksonEventPayloadSerializer;
import com.yunhwan.catalog.usecase.event.port.EventRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
@RequiredArgsConstructor
@Transactional
public class EventRecordStoreAdapter implements EventRecordStore {

    private final StoredEventJpaRepository repo;
    private final JacksonEventPayloadSerializer serializer;

    @Override
    public DomainEvent save(DomainEvent event) {
        try {
            return toDomain(repo.saveAndFlush(toEntity(event)));
        } catch (DataAccessException e) {
            throw new EventPersistenceException(
                    "event append failed. aggregateId=" + event.aggregateId() + ", version=" + event.version(), e);
        }
    }

    /**
     * 한 트랜잭션. 하나라도 실패하면 전부 롤백.
     */
    @Override
    public List<DomainEvent> saveAll(List<DomainEvent> events) {
        try {
            return repo.saveAllAndFlush(events.stream().map(this::toEntity).toList()).stream()
                    .map(this::toDomain)
                    .toList();
        } catch (DataAccessException e) {
            throw new EventPersistenceException(
                    "event batch append failed. size=" + events.size()
                            + ", firstAggregateId=" + events.get(0).aggregateId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<DomainEvent> findByAggregateId(String aggregateId) {
        return repo.findByAggregateIdOrderByVersionAsc(aggregateId).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<DomainEvent> findByAggregateIdAndEventType(String aggregateId, String eventType) {
        return repo.findByAggregateIdAndEventTypeOrderByVersionAsc(aggregateId, eventType).stream()
                .map(this::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public int findLatestVersion(String aggregateId) {
        return repo.findLatestVersion(aggregateId);
    }

    private StoredEvent toEntity(DomainEvent e) {
        return StoredEvent.of(
                e.eventId(),
                e.eventType(),
                e.aggregateId(),
                e.aggregateType(),
                serializer.serialize(e.payload()),
                e.occurredAt(),
                e.version(),
                e.userId(),
                e.correlationId()
        );
    }

    private DomainEvent toDomain(StoredEvent s) {
        return new DomainEvent(
                s.getEventId(),
                s.getEventType(),
                s.getAggregateId(),
                s.getAggregateType(),
                serializer.deserialize(s.getPayload()),
                s.getOccurredAt(),
                s.getVersion(),
                s.getUserId(),
                s.getCorrelationId()
        );
    }
}
