package com.yunhwan.catalog.usecase.loader.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.loader")
public class BatchLoaderProperties {

    /**
     * fetch 1회에 넘기는 최대 키 수. 넘치면 여러 번으로 나눠 호출한다.
     */
    private int maxBatchSize = 100;

    /**
     * dispatch(tick)를 실행하는 스레드 수
     */
    private int tickPoolSize = 2;
}
