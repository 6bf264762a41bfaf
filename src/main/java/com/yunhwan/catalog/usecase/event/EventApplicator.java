package com.yunhwan.catalog.usecase.event;

import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.domain.product.ProductFields;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트 이력을 빈 상태에서부터 접어 aggregate 상태를 만든다.
 * 순수 함수: 같은 이력이면 항상 같은 결과.
 */
@Slf4j
final class EventApplicator {

    private EventApplicator() {}

    static Map<String, Object> fold(List<DomainEvent> history) {
        Map<String, Object> state = new LinkedHashMap<>();
        for (DomainEvent event : history) {
            apply(state, event);
        }
        return Collections.unmodifiableMap(state);
    }

    private static void apply(Map<String, Object> state, DomainEvent event) {
        Optional<EventType> known = event.knownType();
        if (known.isEmpty()) {
            // 신규 스키마 이벤트는 오류가 아니라 skip
            log.debug("[EventApplicator] unknown event type skipped. eventType={}, eventId={}",
                    event.eventType(), event.eventId());
            return;
        }

        EventType type = known.get();
        switch (type.kind()) {
            case CREATED -> state.putAll(event.payload().asMap());
            case FIELD_CHANGED -> {
                Object value = event.payload().get(type.payloadKey());
                if (value == null) {
                    state.remove(type.field());
                } else {
                    state.put(type.field(), value);
                }
            }
            case DELETED -> state.put(ProductFields.DELETED, Boolean.TRUE);
        }
    }
}
