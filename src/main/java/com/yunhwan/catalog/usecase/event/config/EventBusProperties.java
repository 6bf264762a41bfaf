package com.yunhwan.catalog.usecase.event.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.event-bus")
public class EventBusProperties {

    /**
     * dead letter 보관 상한. 가득 차면 가장 오래된 것부터 버린다.
     */
    private int deadLetterCapacity = 1_000;

    private DeadLetterReport deadLetterReport = new DeadLetterReport();

    @Getter @Setter
    public static class DeadLetterReport {
        private boolean enabled = false;
        private long fixedDelayMs = 60_000;
    }
}
