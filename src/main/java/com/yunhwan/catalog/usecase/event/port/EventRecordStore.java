package com.yunhwan.catalog.usecase.event.port;

import com.yunhwan.catalog.domain.event.DomainEvent;

import java.util.List;

/**
 * 이벤트 원장(append-only). insert와 aggregate 단위 정렬 조회만 제공한다.
 * update/delete 연산은 없다.
 */
public interface EventRecordStore {

    DomainEvent save(DomainEvent event);

    /** 전부 저장되거나 전부 실패한다. */
    List<DomainEvent> saveAll(List<DomainEvent> events);

    /** version 오름차순. occurred_at(벽시계)은 순서에 쓰지 않는다. */
    List<DomainEvent> findByAggregateId(String aggregateId);

    List<DomainEvent> findByAggregateIdAndEventType(String aggregateId, String eventType);

    int findLatestVersion(String aggregateId);
}
