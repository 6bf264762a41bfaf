package com.yunhwan.catalog.usecase.product.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "catalog.product")
public class ProductCacheProperties {

    private long listCacheTtlSeconds = 300;

    private long viewCacheTtlSeconds = 600;
}
