package com.yunhwan.catalog.domain.event;

import java.util.Arrays;
import java.util.Optional;

public enum EventType {
    PRODUCT_CREATED("ProductCreated", EventKind.CREATED, null, null),
    PRODUCT_PRICE_CHANGED("ProductPriceChanged", EventKind.FIELD_CHANGED, "price", "newPrice"),
    PRODUCT_INVENTORY_CHANGED("ProductInventoryChanged", EventKind.FIELD_CHANGED, "inventory", "newQuantity"),
    PRODUCT_DELETED("ProductDeleted", EventKind.DELETED, null, null);

    private final String wireName;
    private final EventKind kind;
    private final String field;
    private final String payloadKey;

    EventType(String wireName, EventKind kind, String field, String payloadKey) {
        this.wireName = wireName;
        this.kind = kind;
        this.field = field;
        this.payloadKey = payloadKey;
    }

    public String wireName() {
        return wireName;
    }

    public EventKind kind() {
        return kind;
    }

    /** FIELD_CHANGED 이벤트가 바꾸는 상태 필드. 그 외 kind는 null. */
    public String field() {
        return field;
    }

    /** FIELD_CHANGED 이벤트에서 새 값을 담는 payload 키. */
    public String payloadKey() {
        return payloadKey;
    }

    /**
     * 저장소에 기록된 타입 문자열을 enum으로 해석한다.
     * 모르는 타입(신규 스키마 등)은 empty → replay/projection에서 건너뛴다.
     */
    public static Optional<EventType> fromWireName(String wireName) {
        if (wireName == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(wireName))
                .findFirst();
    }
}
