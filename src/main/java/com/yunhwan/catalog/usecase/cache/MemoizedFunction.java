package com.yunhwan.catalog.usecase.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 읽기 함수 결과를 자신만의 {@link MultiTierCache}에 캐시한다.
 *
 * 키: {@code memo:<functionName>:<sha256(canonical args)>}.
 * 결과가 null이면 캐시하지 않는다. invalidate도 같은 키 생성기를 거치므로 apply와 항상 같은 키를 쓴다.
 */
@Slf4j
public class MemoizedFunction<V> {

    public static final String NAMESPACE_PREFIX = "memo:";

    private final String functionName;
    private final MultiTierCache<V> cache;
    private final Duration ttl;
    private final Function<Map<String, Object>, V> delegate;
    private final CacheKeyGenerator keyGenerator;

    public MemoizedFunction(
            String functionName,
            MultiTierCache<V> cache,
            Duration ttl,
            Function<Map<String, Object>, V> delegate,
            CacheKeyGenerator keyGenerator
    ) {
        this.functionName = functionName;
        this.cache = cache;
        this.ttl = ttl;
        this.delegate = delegate;
        this.keyGenerator = keyGenerator;
    }

    public static String namespaceOf(String functionName) {
        return NAMESPACE_PREFIX + functionName;
    }

    public Optional<V> apply(Map<String, ?> args) {
        String key = keyGenerator.digest(args);

        Optional<V> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached;
        }

        V result = delegate.apply(copyOf(args));
        if (result == null) {
            log.debug("[MemoizedFunction] null result not cached. function={}", functionName);
            return Optional.empty();
        }
        cache.set(key, result, ttl);
        return Optional.of(result);
    }

    /** L2에 저장되는 전체 키 */
    public String keyFor(Map<String, ?> args) {
        return cache.namespace() + ":" + keyGenerator.digest(args);
    }

    public boolean invalidate(Map<String, ?> args) {
        return cache.invalidate(keyGenerator.digest(args));
    }

    public int invalidateAll() {
        return cache.invalidatePattern("");
    }

    public String functionName() {
        return functionName;
    }

    public CacheStats getStats() {
        return cache.getStats();
    }

    private static Map<String, Object> copyOf(Map<String, ?> args) {
        if (args == null) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
}
