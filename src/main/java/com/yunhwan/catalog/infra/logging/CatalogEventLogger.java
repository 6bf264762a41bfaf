package com.yunhwan.catalog.infra.logging;

import com.yunhwan.catalog.domain.command.Command;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.usecase.event.DeadLetter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogEventLogger {

    private final Clock clock;

    public void commandExecuted(Command command, List<DomainEvent> events) {
        Map<String, Object> evt = createBaseEvent("catalog.command_executed", command);
        evt.put("event_count", events.size());
        evt.put("event_ids", events.stream().map(DomainEvent::eventId).toList());
        if (!events.isEmpty()) {
            evt.put("aggregate_id", events.get(0).aggregateId());
        }

        log.info("catalog_event {}", entries(evt));
    }

    public void commandRejected(Command command, List<String> violations) {
        Map<String, Object> evt = createBaseEvent("catalog.command_rejected", command);
        evt.put("violations", violations);

        log.info("catalog_event {}", entries(evt));
    }

    public void deadLetterCaptured(DeadLetter deadLetter) {
        DomainEvent event = deadLetter.event();

        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", "catalog.dead_letter_captured");
        evt.put("log_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("handler", deadLetter.handlerName());
        evt.put("source_event", mapOfNonNull(
                "id", event.eventId(),
                "type", event.eventType(),
                "aggregate_id", event.aggregateId(),
                "version", event.version(),
                "correlation_id", event.correlationId()
        ));
        evt.put("error", mapOfNonNull(
                "type", deadLetter.errorType(),
                "message", deadLetter.errorMessage()
        ));

        log.warn("catalog_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType, Command command) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("log_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("command_type", command.type().name());
        evt.put("correlation_id", command.correlationId());
        if (command.userId() != null) {
            evt.put("user_id", command.userId());
        }
        return evt;
    }

    /**
     * null 값은 넣지 않는 map builder (Map.of는 null 불가).
     */
    private Map<String, Object> mapOfNonNull(Object... kv) {
        if (kv.length % 2 != 0) {
            throw new IllegalArgumentException("kv length must be even. length=" + kv.length);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            if (v != null) {
                m.put(String.valueOf(kv[i]), v);
            }
        }
        return m;
    }
}
