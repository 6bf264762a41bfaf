package com.yunhwan.catalog.usecase.event;

import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.infra.logging.CatalogEventLogger;
import com.yunhwan.catalog.usecase.event.config.EventBusProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.yunhwan.catalog.infra.metrics.MetricsConfig.*;

/**
 * 프로세스 내부 pub/sub.
 *
 * - 이벤트 하나에 대해 handler를 등록 순서대로, 호출 스레드에서 순차 실행한다.
 * - handler 예외는 여기서 끝난다: 로그 + dead letter 적재 후 다음 handler로 계속.
 * - publish()는 어떤 경우에도 예외를 던지지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventBus {

    private final EventBusProperties props;
    private final MeterRegistry meterRegistry;
    private final CatalogEventLogger eventLogger;
    private final Clock clock;

    private final List<EventHandler> handlers = new CopyOnWriteArrayList<>();
    private final Deque<DeadLetter> deadLetters = new ArrayDeque<>();

    @PostConstruct
    void init() {
        Gauge.builder(METRIC_DEAD_LETTER_SIZE, this, EventBus::deadLetterCount)
                .register(meterRegistry);
    }

    public void subscribe(EventHandler handler) {
        handlers.add(handler);
        log.info("[EventBus] subscribed. handler={}, total={}", handler.name(), handlers.size());
    }

    public void publish(DomainEvent event) {
        for (EventHandler handler : handlers) {
            deliver(handler, event);
        }
    }

    public List<DeadLetter> getDeadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    public void clearDeadLetters() {
        synchronized (deadLetters) {
            deadLetters.clear();
        }
    }

    public int deadLetterCount() {
        synchronized (deadLetters) {
            return deadLetters.size();
        }
    }

    /**
     * 운영자 수동 재전달. 현재 쌓인 dead letter를 비우고, 각 건을 실패했던 handler에게만 다시 전달한다.
     * 다시 실패한 건은 새 dead letter로 적재된다. 자동 재시도는 하지 않는다.
     *
     * @return 재전달에 성공한 건수
     */
    public int redeliverDeadLetters() {
        List<DeadLetter> drained;
        synchronized (deadLetters) {
            drained = new ArrayList<>(deadLetters);
            deadLetters.clear();
        }

        int succeeded = 0;
        for (DeadLetter dl : drained) {
            Optional<EventHandler> handler = findHandler(dl.handlerName());
            if (handler.isEmpty()) {
                log.warn("[EventBus] redeliver skipped. handler not subscribed. handler={}, eventId={}",
                        dl.handlerName(), dl.event().eventId());
                capture(dl);
                continue;
            }
            if (deliver(handler.get(), dl.event())) {
                succeeded++;
            }
        }

        log.info("[EventBus] redelivered dead letters. total={}, succeeded={}", drained.size(), succeeded);
        return succeeded;
    }

    private boolean deliver(EventHandler handler, DomainEvent event) {
        try {
            handler.handle(event);
            return true;
        } catch (Exception e) {
            log.warn("[EventBus] handler failed. handler={}, eventId={}, eventType={}, aggregateId={}, err={}",
                    handler.name(), event.eventId(), event.eventType(), event.aggregateId(), e.toString());

            DeadLetter dl = new DeadLetter(
                    event,
                    handler.name(),
                    e.getClass().getSimpleName(),
                    e.getMessage(),
                    OffsetDateTime.now(clock)
            );
            capture(dl);
            meterRegistry.counter(METRIC_DEAD_LETTER, TAG_EVENT_TYPE, event.eventType()).increment();
            eventLogger.deadLetterCaptured(dl);
            return false;
        }
    }

    private void capture(DeadLetter dl) {
        int capacity = Math.max(1, props.getDeadLetterCapacity());
        synchronized (deadLetters) {
            while (deadLetters.size() >= capacity) {
                deadLetters.pollFirst();
            }
            deadLetters.addLast(dl);
        }
    }

    private Optional<EventHandler> findHandler(String name) {
        return handlers.stream()
                .filter(h -> h.name().equals(name))
                .findFirst();
    }
}
