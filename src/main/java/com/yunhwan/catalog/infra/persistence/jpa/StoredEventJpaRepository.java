package com.yunhwan.catalog.infra.persistence.jpa;

import com.yunhwan.catalog.infra.persistence.entity.StoredEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface StoredEventJpaRepository extends JpaRepository<StoredEvent, Long> {

    List<StoredEvent> findByAggregateIdOrderByVersionAsc(String aggregateId);

    List<StoredEvent> findByAggregateIdAndEventTypeOrderByVersionAsc(String aggregateId, String eventType);

    @Query("select coalesce(max(e.version), 0) from StoredEvent e where e.aggregateId = :aggregateId")
    int findLatestVersion(@Param("aggregateId") String aggregateId);
}
