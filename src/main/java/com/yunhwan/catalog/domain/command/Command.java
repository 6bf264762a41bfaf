package com.yunhwan.catalog.domain.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 쓰기 의도. Command 자체는 저장되지 않고, handler가 만든 이벤트만 저장된다.
 */
public record Command(
        CommandType type,
        Map<String, Object> payload,
        String userId,
        String correlationId
) {

    public Command {
        Objects.requireNonNull(type, "type");
        // null 값이 섞인 payload도 받아야 하므로 Map.copyOf 대신 LinkedHashMap 사본
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
    }

    public static Command of(CommandType type, Map<String, Object> payload, String userId) {
        return new Command(type, payload, userId, null);
    }
}
