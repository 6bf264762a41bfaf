package com.yunhwan.catalog.usecase.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import com.yunhwan.catalog.usecase.cache.config.CacheProperties;
import com.yunhwan.catalog.usecase.cache.port.SharedCacheTier;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

import static com.yunhwan.catalog.infra.metrics.MetricsConfig.*;

/**
 * namespace 단위로 격리된 {@link MultiTierCache}를 만든다.
 * 같은 namespace를 두 번 만들 수 없으므로, memoize 대상 함수끼리 키가 섞이는 일이 구조적으로 없다.
 */
@Slf4j
@Component
public class MultiTierCacheFactory {

    private final SharedCacheTier sharedCacheTier;
    private final ObjectMapper objectMapper;
    private final CacheProperties props;
    private final MeterRegistry meterRegistry;
    private final Ticker ticker;
    private final CacheKeyGenerator keyGenerator;

    private final Map<String, MultiTierCache<?>> caches = new ConcurrentHashMap<>();

    @Autowired
    public MultiTierCacheFactory(
            SharedCacheTier sharedCacheTier,
            ObjectMapper objectMapper,
            CacheProperties props,
            MeterRegistry meterRegistry
    ) {
        this(sharedCacheTier, objectMapper, props, meterRegistry, Ticker.systemTicker());
    }

    public MultiTierCacheFactory(
            SharedCacheTier sharedCacheTier,
            ObjectMapper objectMapper,
            CacheProperties props,
            MeterRegistry meterRegistry,
            Ticker ticker
    ) {
        this.sharedCacheTier = sharedCacheTier;
        this.objectMapper = objectMapper;
        this.props = props;
        this.meterRegistry = meterRegistry;
        this.ticker = ticker;
        this.keyGenerator = new CacheKeyGenerator(objectMapper);
    }

    public <V> MultiTierCache<V> create(String namespace, Class<V> valueType) {
        return create(namespace, objectMapper.getTypeFactory().constructType(valueType));
    }

    public <V> MultiTierCache<V> create(String namespace, JavaType valueType) {
        MultiTierCache<V> cache = new MultiTierCache<>(namespace, valueType, sharedCacheTier, objectMapper, props, ticker);
        MultiTierCache<?> prev = caches.putIfAbsent(namespace, cache);
        if (prev != null) {
            throw new IllegalStateException("cache namespace already registered. namespace=" + namespace);
        }
        registerMeters(cache);
        log.info("[MultiTierCacheFactory] cache created. namespace={}, l1MaxSize={}, l1MaxTtlSeconds={}",
                namespace, props.getL1().getMaxSize(), props.getL1().getMaxTtlSeconds());
        return cache;
    }

    /**
     * 함수 하나당 전용 캐시 인스턴스를 만들어 감싼다.
     */
    public <V> MemoizedFunction<V> memoize(
            String functionName,
            Duration ttl,
            JavaType resultType,
            Function<Map<String, Object>, V> fn
    ) {
        MultiTierCache<V> cache = create(MemoizedFunction.namespaceOf(functionName), resultType);
        return new MemoizedFunction<>(functionName, cache, ttl, fn, keyGenerator);
    }

    public <V> MemoizedFunction<V> memoize(
            String functionName,
            Duration ttl,
            Class<V> resultType,
            Function<Map<String, Object>, V> fn
    ) {
        return memoize(functionName, ttl, objectMapper.getTypeFactory().constructType(resultType), fn);
    }

    public Collection<CacheStats> allStats() {
        return caches.values().stream()
                .map(MultiTierCache::getStats)
                .toList();
    }

    private void registerMeters(MultiTierCache<?> cache) {
        counter(cache, TIER_L1, RESULT_HIT, CacheStats::l1Hits);
        counter(cache, TIER_L1, RESULT_MISS, CacheStats::l1Misses);
        counter(cache, TIER_L2, RESULT_HIT, CacheStats::l2Hits);
        counter(cache, TIER_L2, RESULT_MISS, CacheStats::l2Misses);
        counter(cache, TIER_L2, RESULT_ERROR, CacheStats::errors);
    }

    private void counter(MultiTierCache<?> cache, String tier, String result, ToDoubleFunction<CacheStats> fn) {
        FunctionCounter.builder(METRIC_CACHE_REQUESTS, cache, c -> fn.applyAsDouble(c.getStats()))
                .tag(TAG_CACHE, cache.namespace())
                .tag(TAG_TIER, tier)
                .tag(TAG_RESULT, result)
                .register(meterRegistry);
    }
}
