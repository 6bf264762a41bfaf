package com.yunhwan.catalog.domain.event;

/**
 * 이벤트가 aggregate 상태에 반영되는 방식.
 */
public enum EventKind {
    CREATED,        // payload 전체를 상태에 merge
    FIELD_CHANGED,  // 필드 하나만 교체
    DELETED         // deleted 플래그만 세움 (데이터는 남김)
}
