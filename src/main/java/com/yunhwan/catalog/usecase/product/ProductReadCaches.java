package com.yunhwan.catalog.usecase.product;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.usecase.cache.MemoizedFunction;
import com.yunhwan.catalog.usecase.cache.MultiTierCache;
import com.yunhwan.catalog.usecase.cache.MultiTierCacheFactory;
import com.yunhwan.catalog.usecase.product.config.ProductCacheProperties;
import com.yunhwan.catalog.usecase.projection.port.ProductViewStore;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Product 읽기 경로가 공유하는 캐시 두 개.
 * 조회 handler는 채우고, invalidation handler는 비운다.
 */
@Getter
@Component
public class ProductReadCaches {

    public static final String VIEW_NAMESPACE = "product";
    public static final String LIST_BY_COLLECTION = "listProductsByCollection";

    public static final String ARG_COLLECTION = "collection";
    public static final String ARG_LIMIT = "limit";
    public static final String ARG_OFFSET = "offset";

    private final MultiTierCache<ProductView> viewCache;
    private final MemoizedFunction<List<ProductView>> collectionListing;
    private final Duration viewTtl;

    public ProductReadCaches(
            MultiTierCacheFactory cacheFactory,
            ObjectMapper objectMapper,
            ProductViewStore productViewStore,
            ProductCacheProperties props
    ) {
        this.viewTtl = Duration.ofSeconds(props.getViewCacheTtlSeconds());
        this.viewCache = cacheFactory.create(VIEW_NAMESPACE, ProductView.class);

        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, ProductView.class);
        this.collectionListing = cacheFactory.memoize(
                LIST_BY_COLLECTION,
                Duration.ofSeconds(props.getListCacheTtlSeconds()),
                listType,
                args -> listByCollection(productViewStore, args)
        );
    }

    private static List<ProductView> listByCollection(ProductViewStore store, Map<String, Object> args) {
        String collection = String.valueOf(args.get(ARG_COLLECTION));
        int limit = ((Number) args.get(ARG_LIMIT)).intValue();
        int offset = ((Number) args.get(ARG_OFFSET)).intValue();
        return store.findByCollection(collection, limit, offset);
    }
}
