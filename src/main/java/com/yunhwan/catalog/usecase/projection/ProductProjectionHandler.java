package com.yunhwan.catalog.usecase.projection;

import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventPayload;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.domain.product.Prices;
import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.usecase.event.EventBus;
import com.yunhwan.catalog.usecase.event.EventHandler;
import com.yunhwan.catalog.usecase.event.EventStore;
import com.yunhwan.catalog.usecase.projection.port.ProductViewStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.yunhwan.catalog.domain.product.ProductFields.*;

/**
 * Product 이벤트 → product_view 갱신.
 *
 * 멱등 가드: 뷰에 반영된 version 이하의 이벤트는 다시 와도 건너뛴다.
 * 모든 쓰기는 productId 기준 upsert 이므로 같은 이력을 두 번 흘려도 최종 상태는 같다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductProjectionHandler implements EventHandler {

    private final ProductViewStore productViewStore;
    private final EventBus eventBus;
    private final EventStore eventStore;

    public void subscribe() {
        eventBus.subscribe(this);
    }

    @Override
    public void handle(DomainEvent event) {
        Optional<EventType> type = event.knownType();
        if (type.isEmpty()) {
            log.debug("[ProductProjection] unknown event ignored. eventType={}, eventId={}",
                    event.eventType(), event.eventId());
            return;
        }

        switch (type.get()) {
            case PRODUCT_CREATED -> onCreated(event);
            case PRODUCT_PRICE_CHANGED -> onPriceChanged(event);
            case PRODUCT_INVENTORY_CHANGED -> onInventoryChanged(event);
            case PRODUCT_DELETED -> onDeleted(event);
        }
    }

    /**
     * 뷰를 지우고 aggregate 이력 전체를 처음부터 다시 흘린다.
     */
    public Optional<ProductView> rebuild(String aggregateId) {
        productViewStore.deleteById(aggregateId);
        List<DomainEvent> history = eventStore.getEvents(aggregateId);
        for (DomainEvent event : history) {
            handle(event);
        }
        log.info("[ProductProjection] rebuilt. aggregateId={}, events={}", aggregateId, history.size());
        return productViewStore.findById(aggregateId);
    }

    private void onCreated(DomainEvent event) {
        Optional<ProductView> existing = productViewStore.findById(event.aggregateId());
        if (existing.isPresent() && isStale(existing.get(), event)) {
            return;
        }

        EventPayload p = event.payload();
        ProductView view = new ProductView(
                event.aggregateId(),
                p.getString(SKU).orElse(null),
                p.getString(NAME).orElse(null),
                Prices.fromPayload(p.get(PRICE)),
                Prices.fromPayload(p.get(COMPARE_PRICE)),
                p.getString(DESCRIPTION).orElse(null),
                p.getString(COLLECTION).orElse(null),
                toStringList(p.get(IMAGES)),
                toInt(p.get(INVENTORY)),
                false,
                event.version(),
                event.occurredAt()
        );
        productViewStore.save(view);
    }

    private void onPriceChanged(DomainEvent event) {
        findForUpdate(event).ifPresent(view -> productViewStore.save(
                view.withPrice(Prices.fromPayload(event.payload().get(NEW_PRICE)), event.version(), event.occurredAt())));
    }

    private void onInventoryChanged(DomainEvent event) {
        findForUpdate(event).ifPresent(view -> productViewStore.save(
                view.withInventory(toInt(event.payload().get(NEW_QUANTITY)), event.version(), event.occurredAt())));
    }

    private void onDeleted(DomainEvent event) {
        findForUpdate(event).ifPresent(view -> productViewStore.save(
                view.markDeleted(event.version(), event.occurredAt())));
    }

    private Optional<ProductView> findForUpdate(DomainEvent event) {
        Optional<ProductView> view = productViewStore.findById(event.aggregateId());
        if (view.isEmpty()) {
            log.warn("[ProductProjection] view missing -> skip. aggregateId={}, eventType={}, version={}",
                    event.aggregateId(), event.eventType(), event.version());
            return Optional.empty();
        }
        if (isStale(view.get(), event)) {
            return Optional.empty();
        }
        return view;
    }

    private boolean isStale(ProductView view, DomainEvent event) {
        if (event.version() <= view.version()) {
            log.debug("[ProductProjection] already applied -> skip. aggregateId={}, viewVersion={}, eventVersion={}",
                    view.productId(), view.version(), event.version());
            return true;
        }
        return false;
    }

    private static List<String> toStringList(Object v) {
        if (v instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static int toInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        if (v == null) return 0;
        return Integer.parseInt(String.valueOf(v));
    }
}
