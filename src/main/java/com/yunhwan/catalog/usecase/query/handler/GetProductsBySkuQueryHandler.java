package com.yunhwan.catalog.usecase.query.handler;

import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.domain.query.Query;
import com.yunhwan.catalog.usecase.loader.BatchLoader;
import com.yunhwan.catalog.usecase.product.ProductBatchLoaderFactory;
import com.yunhwan.catalog.usecase.query.QueryHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 조회 1회 = 로더 1개. 중복 sku는 한 번만 조회되고, 결과는 입력 순서 그대로.
 */
@Component
@RequiredArgsConstructor
public class GetProductsBySkuQueryHandler implements QueryHandler<List<Optional<ProductView>>> {

    public static final String FILTER_SKUS = "skus";

    private final ProductBatchLoaderFactory loaderFactory;

    @Override
    public List<Optional<ProductView>> handle(Query query) {
        List<String> skus = query.stringList(FILTER_SKUS);
        if (skus.isEmpty()) return List.of();

        BatchLoader<String, ProductView> loader = loaderFactory.create();
        CompletableFuture<List<Optional<ProductView>>> result = loader.loadMany(skus);
        // 이 조회의 키는 전부 모였다 → tick을 기다리지 않고 바로 보낸다. 예약된 tick은 빈 큐를 보고 끝난다
        loader.dispatch();
        try {
            return result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
