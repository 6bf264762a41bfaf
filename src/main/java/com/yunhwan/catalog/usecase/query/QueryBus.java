package com.yunhwan.catalog.usecase.query;

import com.yunhwan.catalog.common.exception.UnhandledTypeException;
import com.yunhwan.catalog.domain.query.Query;
import com.yunhwan.catalog.domain.query.QueryType;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

import static com.yunhwan.catalog.infra.metrics.MetricsConfig.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class QueryBus {

    private final MeterRegistry meterRegistry;

    private final Map<QueryType, QueryHandler<?>> handlers = new EnumMap<>(QueryType.class);

    public synchronized void registerHandler(QueryType type, QueryHandler<?> handler) {
        QueryHandler<?> prev = handlers.put(type, handler);
        if (prev != null) {
            log.info("[QueryBus] handler replaced. type={}", type);
        }
    }

    /**
     * handler 결과를 그대로 돌려준다. 반환 타입은 QueryType 별 handler가 정한다.
     */
    @SuppressWarnings("unchecked")
    public <R> R execute(Query query) {
        QueryHandler<?> handler = lookup(query.type());
        if (handler == null) {
            record(query.type(), RESULT_ERROR);
            throw new UnhandledTypeException("query", query.type());
        }
        try {
            R result = (R) handler.handle(query);
            record(query.type(), RESULT_SUCCESS);
            return result;
        } catch (RuntimeException e) {
            record(query.type(), RESULT_ERROR);
            throw e;
        }
    }

    public synchronized boolean hasHandler(QueryType type) {
        return handlers.containsKey(type);
    }

    private synchronized QueryHandler<?> lookup(QueryType type) {
        return handlers.get(type);
    }

    private void record(QueryType type, String result) {
        meterRegistry.counter(METRIC_QUERY, TAG_QUERY_TYPE, type.name(), TAG_RESULT, result).increment();
    }
}
