package com.yunhwan.catalog.usecase.cache;

public record CacheStats(
        String namespace,
        long l1Hits,
        long l1Misses,
        long l2Hits,
        long l2Misses,
        long sets,
        long deletes,
        long errors,
        double hitRate,
        long l1Size,
        long l1MaxSize
) {
}
