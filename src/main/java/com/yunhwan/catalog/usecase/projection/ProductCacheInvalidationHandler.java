package com.yunhwan.catalog.usecase.projection;

import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.product.ProductFields;
import com.yunhwan.catalog.usecase.event.EventBus;
import com.yunhwan.catalog.usecase.event.EventHandler;
import com.yunhwan.catalog.usecase.product.ProductReadCaches;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 뷰가 바뀐 뒤 읽기 캐시를 비운다. projection 다음 순서로 구독해야 한다.
 * 컬렉션 목록은 어떤 페이지에 걸리는지 알 수 없으므로 namespace 통째로 지운다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductCacheInvalidationHandler implements EventHandler {

    private final ProductReadCaches caches;
    private final EventBus eventBus;

    public void subscribe() {
        eventBus.subscribe(this);
    }

    @Override
    public void handle(DomainEvent event) {
        if (!ProductFields.AGGREGATE_TYPE.equals(event.aggregateType()) || event.knownType().isEmpty()) {
            return;
        }
        caches.getViewCache().invalidate(event.aggregateId());
        int listings = caches.getCollectionListing().invalidateAll();
        log.debug("[ProductCacheInvalidation] evicted. aggregateId={}, listings={}", event.aggregateId(), listings);
    }
}
