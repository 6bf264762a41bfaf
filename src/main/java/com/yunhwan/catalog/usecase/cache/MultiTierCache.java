package com.yunhwan.catalog.usecase.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.yunhwan.catalog.usecase.cache.config.CacheProperties;
import com.yunhwan.catalog.usecase.cache.port.SharedCacheTier;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * cache-aside 2단 캐시.
 *
 * <ul>
 *   <li>L1: 프로세스 로컬 Caffeine (크기 + TTL 상한)</li>
 *   <li>L2: 공유 캐시 ({@link SharedCacheTier}), 값은 JSON</li>
 * </ul>
 *
 * set 규칙: L1 먼저 동기 기록 → L2 기록이 끝날 때까지 기다린 뒤 반환.
 * L2 hit을 L1으로 올릴 때는 L2에 남은 TTL(L1 상한 적용)을 쓴다. L1이 L2보다 오래 살지 않는다.
 * L2 장애는 절대 호출자에게 올라가지 않는다 (miss + errors 카운트).
 */
@Slf4j
public class MultiTierCache<V> {

    private final String namespace;
    private final JavaType valueType;
    private final SharedCacheTier l2;
    private final ObjectMapper objectMapper;
    private final Duration defaultTtl;
    private final Duration l1MaxTtl;
    private final long l1MaxSize;
    private final Cache<String, L1Entry<V>> l1;

    private final AtomicLong l1Hits = new AtomicLong();
    private final AtomicLong l1Misses = new AtomicLong();
    private final AtomicLong l2Hits = new AtomicLong();
    private final AtomicLong l2Misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();
    private final AtomicLong deletes = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public MultiTierCache(
            String namespace,
            JavaType valueType,
            SharedCacheTier l2,
            ObjectMapper objectMapper,
            CacheProperties props,
            Ticker ticker
    ) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.l2 = Objects.requireNonNull(l2, "l2");
        this.objectMapper = objectMapper;
        this.defaultTtl = Duration.ofSeconds(props.getDefaultTtlSeconds());
        this.l1MaxTtl = Duration.ofSeconds(props.getL1().getMaxTtlSeconds());
        this.l1MaxSize = props.getL1().getMaxSize();
        this.l1 = Caffeine.newBuilder()
                .maximumSize(l1MaxSize)
                .expireAfter(new PerEntryExpiry<V>())
                // 정리 작업을 호출 스레드에서 → eviction 결과가 즉시 보인다
                .executor(Runnable::run)
                .ticker(ticker)
                .build();
    }

    public String namespace() {
        return namespace;
    }

    public Optional<V> get(String key) {
        L1Entry<V> hit = l1.getIfPresent(key);
        if (hit != null) {
            l1Hits.incrementAndGet();
            return Optional.of(hit.value());
        }
        l1Misses.incrementAndGet();

        Optional<V> fromL2 = readL2(key);
        if (fromL2.isPresent()) {
            l2Hits.incrementAndGet();
            l1.put(key, new L1Entry<>(fromL2.get(), l1TtlNanos(remainingL2Ttl(key))));
            return fromL2;
        }
        l2Misses.incrementAndGet();
        return Optional.empty();
    }

    public void set(String key, V value) {
        set(key, value, defaultTtl);
    }

    public void set(String key, V value, Duration ttl) {
        if (value == null) {
            log.debug("[MultiTierCache] null value ignored. namespace={}, key={}", namespace, key);
            return;
        }
        Duration effective = (ttl == null || ttl.isZero() || ttl.isNegative()) ? defaultTtl : ttl;

        // 1) L1 동기 기록 → 직후 get은 L1에서 바로 보인다
        l1.put(key, new L1Entry<>(value, l1TtlNanos(effective)));
        sets.incrementAndGet();

        // 2) L2 기록 완료까지 대기 (실패는 삼킨다)
        try {
            l2.set(l2Key(key), objectMapper.writeValueAsString(value), effective);
        } catch (Exception e) {
            errors.incrementAndGet();
            log.warn("[MultiTierCache] L2 set failed. namespace={}, key={}, err={}", namespace, key, e.toString());
        }
    }

    /**
     * @return 저장된 건수
     */
    public int warm(Map<String, V> entries, Duration ttl) {
        int count = 0;
        for (Map.Entry<String, V> e : entries.entrySet()) {
            if (e.getValue() == null) continue;
            set(e.getKey(), e.getValue(), ttl);
            count++;
        }
        log.info("[MultiTierCache] warmed. namespace={}, entries={}", namespace, count);
        return count;
    }

    public boolean invalidate(String key) {
        boolean removed = l1.asMap().remove(key) != null;
        try {
            removed |= l2.delete(l2Key(key));
        } catch (Exception e) {
            errors.incrementAndGet();
            log.warn("[MultiTierCache] L2 delete failed. namespace={}, key={}, err={}", namespace, key, e.toString());
        }
        if (removed) {
            deletes.incrementAndGet();
        }
        return removed;
    }

    /**
     * prefix로 시작하는 키를 두 tier에서 모두 지운다.
     *
     * @return 지워진 논리 키 수 (L1/L2 양쪽에 있던 키는 한 번만 센다)
     */
    public int invalidatePattern(String prefix) {
        String p = prefix == null ? "" : prefix;
        Set<String> removed = new HashSet<>();

        l1.asMap().keySet().removeIf(k -> {
            if (k.startsWith(p)) {
                removed.add(k);
                return true;
            }
            return false;
        });

        try {
            String l2Prefix = l2Key("");
            for (String fullKey : l2.deleteByPrefix(l2Key(p))) {
                removed.add(fullKey.startsWith(l2Prefix) ? fullKey.substring(l2Prefix.length()) : fullKey);
            }
        } catch (Exception e) {
            errors.incrementAndGet();
            log.warn("[MultiTierCache] L2 pattern delete failed. namespace={}, prefix={}, err={}",
                    namespace, p, e.toString());
        }

        deletes.addAndGet(removed.size());
        log.debug("[MultiTierCache] pattern invalidated. namespace={}, prefix={}, removed={}", namespace, p, removed.size());
        return removed.size();
    }

    public CacheStats getStats() {
        long hits1 = l1Hits.get();
        long miss1 = l1Misses.get();
        long hits2 = l2Hits.get();
        long requests = hits1 + miss1;
        double hitRate = requests == 0 ? 0.0 : (double) (hits1 + hits2) / requests;

        return new CacheStats(
                namespace,
                hits1,
                miss1,
                hits2,
                l2Misses.get(),
                sets.get(),
                deletes.get(),
                errors.get(),
                hitRate,
                l1.estimatedSize(),
                l1MaxSize
        );
    }

    private Optional<V> readL2(String key) {
        try {
            Optional<String> raw = l2.get(l2Key(key));
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            V value = objectMapper.readValue(raw.get(), valueType);
            return Optional.ofNullable(value);
        } catch (Exception e) {
            // 네트워크 장애/역직렬화 실패 모두 miss로 취급
            errors.incrementAndGet();
            log.warn("[MultiTierCache] L2 get failed -> miss. namespace={}, key={}, err={}", namespace, key, e.toString());
            return Optional.empty();
        }
    }

    private Duration remainingL2Ttl(String key) {
        try {
            return l2.remainingTtl(l2Key(key)).orElse(defaultTtl);
        } catch (Exception e) {
            errors.incrementAndGet();
            log.warn("[MultiTierCache] L2 ttl lookup failed. namespace={}, key={}, err={}", namespace, key, e.toString());
            return defaultTtl;
        }
    }

    private String l2Key(String key) {
        return namespace + ":" + key;
    }

    private long l1TtlNanos(Duration ttl) {
        Duration capped = ttl.compareTo(l1MaxTtl) > 0 ? l1MaxTtl : ttl;
        return capped.toNanos();
    }

    private record L1Entry<T>(T value, long ttlNanos) {
    }

    private static final class PerEntryExpiry<T> implements Expiry<String, L1Entry<T>> {

        @Override
        public long expireAfterCreate(String key, L1Entry<T> entry, long currentTime) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, L1Entry<T> entry, long currentTime, long currentDuration) {
            return entry.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, L1Entry<T> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
