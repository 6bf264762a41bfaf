package com.yunhwan.catalog.usecase.query.handler;

import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.domain.query.Query;
import com.yunhwan.catalog.usecase.product.ProductReadCaches;
import com.yunhwan.catalog.usecase.query.QueryHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.yunhwan.catalog.usecase.product.ProductReadCaches.*;

@Component
@RequiredArgsConstructor
public class ListProductsByCollectionQueryHandler implements QueryHandler<List<ProductView>> {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final ProductReadCaches caches;

    @Override
    public List<ProductView> handle(Query query) {
        String collection = query.requireString(ARG_COLLECTION);
        int limit = Math.min(Math.max(query.intOr(ARG_LIMIT, DEFAULT_LIMIT), 1), MAX_LIMIT);
        int offset = Math.max(query.intOr(ARG_OFFSET, 0), 0);

        // 정규화된 값으로 키를 만든다. limit 생략과 limit=20은 같은 키
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(ARG_COLLECTION, collection);
        args.put(ARG_LIMIT, limit);
        args.put(ARG_OFFSET, offset);
        return caches.getCollectionListing().apply(args).orElse(List.of());
    }
}
