package com.yunhwan.catalog.infra.scheduling;

import com.yunhwan.catalog.usecase.event.DeadLetter;
import com.yunhwan.catalog.usecase.event.EventBus;
import com.yunhwan.catalog.usecase.event.config.EventBusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * dead letter가 쌓여 있으면 주기적으로 handler별 개수를 경고 로그로 남긴다. 재처리는 하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "catalog.event-bus.dead-letter-report", name = "enabled", havingValue = "true")
public class DeadLetterReportScheduler implements SchedulingConfigurer {

    private final EventBus eventBus;
    private final EventBusProperties props;
    private final TaskScheduler catalogTaskScheduler;

    @Override
    public void configureTasks(ScheduledTaskRegistrar taskRegistrar) {
        long delay = props.getDeadLetterReport().getFixedDelayMs();

        taskRegistrar.setScheduler(catalogTaskScheduler);
        taskRegistrar.addFixedDelayTask(this::tick, Duration.ofMillis(delay));
    }

    void tick() {
        List<DeadLetter> deadLetters = eventBus.getDeadLetters();
        if (deadLetters.isEmpty()) return;

        Map<String, Long> byHandler = deadLetters.stream()
                .collect(Collectors.groupingBy(DeadLetter::handlerName, TreeMap::new, Collectors.counting()));
        log.warn("[dead-letter-report] {} dead letters pending. byHandler={}", deadLetters.size(), byHandler);
    }
}
