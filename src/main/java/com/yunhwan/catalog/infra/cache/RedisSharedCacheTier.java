package com.yunhwan.catalog.infra.cache;

import com.yunhwan.catalog.usecase.cache.config.CacheProperties;
import com.yunhwan.catalog.usecase.cache.port.SharedCacheTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * L2 = Redis. 모든 키 앞에 catalog.cache.key-prefix 를 붙인다.
 * 예외는 삼키지 않는다. 장애를 miss로 바꾸는 것은 MultiTierCache 몫.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisSharedCacheTier implements SharedCacheTier {

    private static final int SCAN_COUNT = 500;
    private static final int DELETE_CHUNK = 500;

    private final StringRedisTemplate redisTemplate;
    private final CacheProperties props;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(fullKey(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(fullKey(key), value, ttl);
    }

    @Override
    public Optional<Duration> remainingTtl(String key) {
        // PTTL: -2 = 키 없음, -1 = 만료 없음
        Long millis = redisTemplate.getExpire(fullKey(key), TimeUnit.MILLISECONDS);
        if (millis == null || millis < 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(redisTemplate.delete(fullKey(key)));
    }

    /**
     * SCAN MATCH prefix* 로 찾아 지운다. KEYS는 쓰지 않는다.
     *
     * @return 지운 키 (key-prefix 제거한 형태)
     */
    @Override
    public Set<String> deleteByPrefix(String prefix) {
        String keyPrefix = props.getKeyPrefix();
        ScanOptions options = ScanOptions.scanOptions()
                .match(escapeGlob(keyPrefix + prefix) + "*")
                .count(SCAN_COUNT)
                .build();

        Set<String> found = new LinkedHashSet<>();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            while (cursor.hasNext()) {
                found.add(cursor.next());
            }
        }

        List<String> chunk = new ArrayList<>(DELETE_CHUNK);
        for (String k : found) {
            chunk.add(k);
            if (chunk.size() == DELETE_CHUNK) {
                redisTemplate.delete(chunk);
                chunk = new ArrayList<>(DELETE_CHUNK);
            }
        }
        if (!chunk.isEmpty()) {
            redisTemplate.delete(chunk);
        }

        Set<String> stripped = new LinkedHashSet<>();
        for (String k : found) {
            stripped.add(k.substring(keyPrefix.length()));
        }
        log.debug("[RedisSharedCacheTier] deleteByPrefix. prefix={}, deleted={}", prefix, stripped.size());
        return stripped;
    }

    private String fullKey(String key) {
        return props.getKeyPrefix() + key;
    }

    /**
     * Redis glob 메타문자(* ? [ ] \) 이스케이프. 키에 들어간 문자가 패턴으로 해석되지 않게.
     */
    static String escapeGlob(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 8);
        for (char c : s.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
