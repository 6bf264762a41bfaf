package com.yunhwan.catalog.infra.persistence.entity;

import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.Type;

import java.time.OffsetDateTime;

/**
 * append-only 원장. insert 외의 쓰기는 없다 (@Immutable).
 * (aggregate_id, version) 유니크 = 같은 version을 두 번 쓰려는 동시 command는 하나만 성공.
 */
@Entity
@Immutable
@Table(
        name = "event_store",
        indexes = {
                @Index(name = "ix_event_store_type", columnList = "event_type")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_event_store_event_id", columnNames = "event_id"),
                @UniqueConstraint(name = "ux_event_store_aggregate_version", columnNames = {"aggregate_id", "version"})
        }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class StoredEvent {

    /**
     * 전역 저장 순서. aggregate 안의 순서는 version이 정한다.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long seq;

    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Type(JsonBinaryType.class)
    @Column(name = "payload", nullable = false, columnDefinition = "jsonb")
    private String payload;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    @Column(name = "version", nullable = false)
    private int version;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "correlation_id", length = 100)
    private String correlationId;

    public static StoredEvent of(
            String eventId,
            String eventType,
            String aggregateId,
            String aggregateType,
            String payloadJson,
            OffsetDateTime occurredAt,
            int version,
            String userId,
            String correlationId
    ) {
        StoredEvent e = new StoredEvent();
        e.eventId = eventId;
        e.eventType = eventType;
        e.aggregateId = aggregateId;
        e.aggregateType = aggregateType;
        e.payload = payloadJson;
        e.occurredAt = occurredAt;
        e.version = version;
        e.userId = userId;
        e.correlationId = correlationId;
        return e;
    }
}
