package com.yunhwan.catalog.usecase.query;

import com.yunhwan.catalog.domain.query.Query;

/**
 * 읽기 전용. projection 저장소, 캐시, 배치 로더만 본다. 이벤트 저장소는 보지 않는다.
 */
@FunctionalInterface
public interface QueryHandler<R> {

    R handle(Query query);
}
