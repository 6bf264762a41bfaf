package com.yunhwan.catalog.infra.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.yunhwan.catalog.domain.event.EventPayload;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * jsonb 컬럼 ↔ 값 객체. 소수는 BigDecimal로 읽는다 (가격 정밀도 유지).
 */
@Component
public class JacksonEventPayloadSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public JacksonEventPayloadSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public String serialize(EventPayload payload) {
        return write(payload.asMap(), "event payload");
    }

    public EventPayload deserialize(String json) {
        if (json == null || json.isBlank()) return EventPayload.empty();
        try {
            return EventPayload.of(reader.forType(MAP_TYPE).readValue(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to deserialize event payload", e);
        }
    }

    public String serializeStrings(List<String> values) {
        return write(values == null ? List.of() : values, "string list");
    }

    public List<String> deserializeStrings(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return reader.forType(STRING_LIST_TYPE).readValue(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to deserialize string list", e);
        }
    }

    private String write(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize " + what, e);
        }
    }
}
