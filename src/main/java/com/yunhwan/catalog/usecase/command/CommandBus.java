package com.yunhwan.catalog.usecase.command;

import com.yunhwan.catalog.common.exception.CommandValidationException;
import com.yunhwan.catalog.common.exception.UnhandledTypeException;
import com.yunhwan.catalog.domain.command.Command;
import com.yunhwan.catalog.domain.command.CommandType;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.infra.logging.CatalogEventLogger;
import com.yunhwan.catalog.usecase.event.EventStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.yunhwan.catalog.infra.metrics.MetricsConfig.*;

/**
 * command → handler(검증 + 이벤트 생성) → EventStore.appendAll.
 *
 * handler가 예외를 던지면 아무것도 저장되지 않는다.
 * appendAll이 성공한 뒤에야 이벤트가 publish 되므로, projection은 저장된 이벤트만 본다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandBus {

    private final EventStore eventStore;
    private final MeterRegistry meterRegistry;
    private final CatalogEventLogger eventLogger;

    private final Map<CommandType, CommandHandler> handlers = new EnumMap<>(CommandType.class);

    public synchronized void registerHandler(CommandType type, CommandHandler handler) {
        CommandHandler prev = handlers.put(type, handler);
        if (prev != null) {
            log.info("[CommandBus] handler replaced. type={}", type);
        }
    }

    public List<DomainEvent> execute(Command command) {
        CommandHandler handler = lookup(command.type());
        if (handler == null) {
            record(command.type(), RESULT_ERROR);
            throw new UnhandledTypeException("command", command.type());
        }

        List<DomainEvent> events;
        try {
            events = handler.handle(command);
        } catch (CommandValidationException e) {
            record(command.type(), RESULT_REJECTED);
            eventLogger.commandRejected(command, e.getViolations());
            throw e;
        }

        try {
            List<DomainEvent> persisted = eventStore.appendAll(events);
            record(command.type(), RESULT_SUCCESS);
            eventLogger.commandExecuted(command, persisted);
            return persisted;
        } catch (RuntimeException e) {
            record(command.type(), RESULT_ERROR);
            log.error("[CommandBus] append failed. type={}, correlationId={}, err={}",
                    command.type(), command.correlationId(), e.toString());
            throw e;
        }
    }

    public synchronized boolean hasHandler(CommandType type) {
        return handlers.containsKey(type);
    }

    private synchronized CommandHandler lookup(CommandType type) {
        return handlers.get(type);
    }

    private void record(CommandType type, String result) {
        meterRegistry.counter(METRIC_COMMAND, TAG_COMMAND_TYPE, type.name(), TAG_RESULT, result).increment();
    }
}
