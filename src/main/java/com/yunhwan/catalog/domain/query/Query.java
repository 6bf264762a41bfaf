package com.yunhwan.catalog.domain.query;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 읽기 의도. 어떤 상태도 바꾸지 않는다.
 */
public record Query(QueryType type, Map<String, Object> filters) {

    public Query {
        Objects.requireNonNull(type, "type");
        filters = filters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static Query of(QueryType type, Map<String, Object> filters) {
        return new Query(type, filters);
    }

    public String requireString(String key) {
        Object v = filters.get(key);
        if (v == null) {
            throw new IllegalArgumentException("missing filter: " + key);
        }
        String s = String.valueOf(v).trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("blank filter: " + key);
        }
        return s;
    }

    public int intOr(String key, int defaultValue) {
        Object v = filters.get(key);
        if (v == null) return defaultValue;
        try {
            if (v instanceof Number n) return n.intValue();
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid filter(int): " + key + "=" + v, e);
        }
    }

    public List<String> stringList(String key) {
        Object v = filters.get(key);
        if (v == null) return List.of();
        if (v instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).toList();
        }
        throw new IllegalArgumentException("invalid filter(list): " + key + "=" + v);
    }
}
