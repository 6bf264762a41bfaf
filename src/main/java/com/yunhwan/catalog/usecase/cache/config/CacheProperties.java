package com.yunhwan.catalog.usecase.cache.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.cache")
public class CacheProperties {

    /**
     * L2(Redis) 전체 키 prefix
     */
    private String keyPrefix = "catalog:";

    /**
     * set 시 TTL을 주지 않았을 때 쓰는 기본값
     */
    private long defaultTtlSeconds = 3_600;

    private L1 l1 = new L1();

    @Getter @Setter
    public static class L1 {
        private long maxSize = 1_000;
        /** L1 entry는 요청 TTL과 이 값 중 짧은 쪽으로 만료 */
        private long maxTtlSeconds = 300;
    }
}
