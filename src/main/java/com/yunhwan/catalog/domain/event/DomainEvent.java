package com.yunhwan.catalog.domain.event;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * append 이후 절대 수정/삭제되지 않는 이벤트.
 *
 * eventType은 저장소와 주고받는 문자열(wire name)이다.
 * 코드에서 분기할 때는 {@link #knownType()}으로 닫힌 enum을 얻어 쓴다.
 */
public record DomainEvent(
        String eventId,
        String eventType,
        String aggregateId,
        String aggregateType,
        EventPayload payload,
        OffsetDateTime occurredAt,
        int version,
        String userId,
        String correlationId
) {

    public DomainEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(occurredAt, "occurredAt");
        payload = payload == null ? EventPayload.empty() : payload;
    }

    public static DomainEvent create(
            EventType type,
            String aggregateId,
            String aggregateType,
            EventPayload payload,
            int version,
            String userId,
            String correlationId,
            Clock clock
    ) {
        return new DomainEvent(
                UUID.randomUUID().toString(),
                type.wireName(),
                aggregateId,
                aggregateType,
                payload,
                OffsetDateTime.now(clock),
                version,
                userId,
                correlationId
        );
    }

    public Optional<EventType> knownType() {
        return EventType.fromWireName(eventType);
    }

    public boolean is(EventType type) {
        return type.wireName().equals(eventType);
    }
}
