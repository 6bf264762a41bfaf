package com.yunhwan.catalog.usecase.cache.port;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * 프로세스 간 공유되는 네트워크 캐시(L2).
 *
 * 구현체는 장애를 숨기지 않고 그대로 던진다. miss 처리는 호출하는 {@code MultiTierCache}의 몫.
 */
public interface SharedCacheTier {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    boolean delete(String key);

    /**
     * @return 남은 TTL. 키가 없거나 만료가 걸려 있지 않으면 empty
     */
    Optional<Duration> remainingTtl(String key);

    /**
     * prefix로 시작하는 키를 scan 해서 지운다.
     *
     * @return 지운 키 목록 (호출 시 넘긴 키 형태 그대로)
     */
    Set<String> deleteByPrefix(String prefix);
}
