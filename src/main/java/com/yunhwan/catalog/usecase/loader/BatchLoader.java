package com.yunhwan.catalog.usecase.loader;

import com.yunhwan.catalog.common.exception.BatchFetchException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.IntConsumer;

/**
 * 단건 load 요청을 tick 단위로 모아 한 번의 배치 fetch로 바꾼다.
 *
 * <ul>
 *   <li>직전 dispatch 이후 처음 들어온 키가 tick executor에 dispatch를 1회 예약한다.</li>
 *   <li>같은 키는 한 번만 fetch 하고, 모든 호출자가 같은 future를 받는다.</li>
 *   <li>한 번 풀린 키는 이 인스턴스가 살아있는 동안 캐시된다 → 요청 경계마다 새로 만들 것.</li>
 *   <li>없는 키는 예외가 아니라 {@code Optional.empty()}로 끝난다.</li>
 * </ul>
 */
@Slf4j
public class BatchLoader<K, V> {

    private final BatchFetcher<K, V> fetcher;
    private final Executor tickExecutor;
    private final int maxBatchSize;
    private final IntConsumer batchSizeRecorder;

    // 아래 세 필드는 this 모니터로 보호
    private final Map<K, CompletableFuture<Optional<V>>> resolved = new HashMap<>();
    private final Map<K, CompletableFuture<Optional<V>>> pending = new LinkedHashMap<>();
    private boolean dispatchScheduled = false;

    public BatchLoader(BatchFetcher<K, V> fetcher, Executor tickExecutor, int maxBatchSize) {
        this(fetcher, tickExecutor, maxBatchSize, size -> { });
    }

    public BatchLoader(BatchFetcher<K, V> fetcher, Executor tickExecutor, int maxBatchSize, IntConsumer batchSizeRecorder) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be >= 1. maxBatchSize=" + maxBatchSize);
        }
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.tickExecutor = Objects.requireNonNull(tickExecutor, "tickExecutor");
        this.maxBatchSize = maxBatchSize;
        this.batchSizeRecorder = batchSizeRecorder;
    }

    public CompletableFuture<Optional<V>> load(K key) {
        Objects.requireNonNull(key, "key");
        boolean schedule = false;
        CompletableFuture<Optional<V>> future;

        synchronized (this) {
            future = resolved.get(key);
            if (future != null) {
                return future;
            }
            future = new CompletableFuture<>();
            resolved.put(key, future);
            pending.put(key, future);
            if (!dispatchScheduled) {
                dispatchScheduled = true;
                schedule = true;
            }
        }

        if (schedule) {
            tickExecutor.execute(this::dispatch);
        }
        return future;
    }

    /**
     * 결과 i번째 = 입력 키 i번째. 중복 키도 각 위치에 같은 결과가 들어간다.
     */
    public CompletableFuture<List<Optional<V>>> loadMany(List<K> keys) {
        List<CompletableFuture<Optional<V>>> futures = new ArrayList<>(keys.size());
        for (K key : keys) {
            futures.add(load(key));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * 대기 중인 키를 모두 꺼내 fetch 한다. tick에서 자동 호출되지만 직접 불러도 된다.
     * 꺼낼 것이 없으면 아무 것도 하지 않는다.
     */
    public void dispatch() {
        List<Map.Entry<K, CompletableFuture<Optional<V>>>> batch;
        synchronized (this) {
            dispatchScheduled = false;
            if (pending.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(pending.size());
            for (Map.Entry<K, CompletableFuture<Optional<V>>> e : pending.entrySet()) {
                batch.add(Map.entry(e.getKey(), e.getValue()));
            }
            pending.clear();
        }

        for (int from = 0; from < batch.size(); from += maxBatchSize) {
            List<Map.Entry<K, CompletableFuture<Optional<V>>>> chunk =
                    batch.subList(from, Math.min(from + maxBatchSize, batch.size()));
            fetchChunk(chunk);
        }
    }

    /** 캐시에 값을 미리 넣는다. 이미 있는 키는 건드리지 않는다. */
    public synchronized void prime(K key, V value) {
        resolved.putIfAbsent(key, CompletableFuture.completedFuture(Optional.ofNullable(value)));
    }

    /** 캐시에서 키를 뺀다. 다음 load는 다시 fetch 한다. */
    public synchronized void clear(K key) {
        CompletableFuture<Optional<V>> f = resolved.get(key);
        if (f != null && f.isDone()) {
            resolved.remove(key);
        }
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void fetchChunk(List<Map.Entry<K, CompletableFuture<Optional<V>>>> chunk) {
        List<K> keys = chunk.stream().map(Map.Entry::getKey).toList();
        batchSizeRecorder.accept(keys.size());

        Map<K, V> result;
        try {
            result = fetcher.fetch(keys);
        } catch (Exception e) {
            log.warn("[BatchLoader] batch fetch failed. keys={}, err={}", keys.size(), e.toString());
            BatchFetchException failure = new BatchFetchException("batch fetch failed. keys=" + keys.size(), e);
            synchronized (this) {
                // 실패는 캐시하지 않는다 → 다음 load에서 재시도
                for (K key : keys) {
                    resolved.remove(key);
                }
            }
            for (Map.Entry<K, CompletableFuture<Optional<V>>> entry : chunk) {
                entry.getValue().completeExceptionally(failure);
            }
            return;
        }

        Map<K, V> found = result == null ? Map.of() : result;
        for (Map.Entry<K, CompletableFuture<Optional<V>>> entry : chunk) {
            entry.getValue().complete(Optional.ofNullable(found.get(entry.getKey())));
        }
        log.debug("[BatchLoader] batch fetched. requested={}, found={}", keys.size(), found.size());
    }
}
