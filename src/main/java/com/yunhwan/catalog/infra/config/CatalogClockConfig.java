package com.yunhwan.catalog.infra.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 이벤트 occurredAt, dead letter failedAt, 뷰 updatedAt이 모두 이 Clock을 쓴다.
 * 다른 Clock 빈이 있으면(고정 시계 등) 그쪽이 이긴다.
 */
@Configuration(proxyBeanMethods = false)
public class CatalogClockConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock catalogClock() {
        return Clock.systemUTC();
    }
}
