package com.yunhwan.catalog.domain.event;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 이벤트 payload 값 객체.
 *
 * 생성 시점에 중첩 Map/List까지 불변 사본으로 고정하므로,
 * 호출자가 원본 Map을 나중에 바꿔도 저장된 이벤트에는 영향이 없다.
 * null 값은 보관하지 않는다.
 */
public final class EventPayload {

    private static final EventPayload EMPTY = new EventPayload(Collections.emptyMap());

    private final Map<String, Object> values;

    private EventPayload(Map<String, Object> values) {
        this.values = values;
    }

    public static EventPayload empty() {
        return EMPTY;
    }

    public static EventPayload of(Map<String, ?> source) {
        if (source == null || source.isEmpty()) return EMPTY;
        return new EventPayload(freezeMap(source));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Optional<String> getString(String key) {
        Object v = values.get(key);
        return v == null ? Optional.empty() : Optional.of(String.valueOf(v));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> {
            if (k == null) {
                throw new IllegalArgumentException("payload key must not be null");
            }
            if (v != null) {
                copy.put(String.valueOf(k), freeze(v));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object v) {
        if (v instanceof Map<?, ?> m) return freezeMap(m);
        if (v instanceof Collection<?> c) {
            List<Object> list = new ArrayList<>(c.size());
            for (Object item : c) {
                if (item != null) list.add(freeze(item));
            }
            return Collections.unmodifiableList(list);
        }
        return v;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventPayload that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
