package com.yunhwan.catalog.usecase.query.handler;

import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.domain.query.Query;
import com.yunhwan.catalog.usecase.product.ProductReadCaches;
import com.yunhwan.catalog.usecase.projection.port.ProductViewStore;
import com.yunhwan.catalog.usecase.query.QueryHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.yunhwan.catalog.domain.product.ProductFields.PRODUCT_ID;

/**
 * cache-aside: 캐시 → 없으면 projection 조회 후 채움. 삭제된 상품은 캐시하지 않고 empty.
 */
@Component
@RequiredArgsConstructor
public class GetProductQueryHandler implements QueryHandler<Optional<ProductView>> {

    private final ProductViewStore productViewStore;
    private final ProductReadCaches caches;

    @Override
    public Optional<ProductView> handle(Query query) {
        String productId = query.requireString(PRODUCT_ID);

        Optional<ProductView> cached = caches.getViewCache().get(productId);
        if (cached.isPresent()) {
            return cached.filter(v -> !v.deleted());
        }

        Optional<ProductView> loaded = productViewStore.findById(productId).filter(v -> !v.deleted());
        loaded.ifPresent(v -> caches.getViewCache().set(productId, v, caches.getViewTtl()));
        return loaded;
    }
}
