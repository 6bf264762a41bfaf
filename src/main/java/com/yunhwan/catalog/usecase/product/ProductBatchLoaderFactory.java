package com.yunhwan.catalog.usecase.product;

import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.usecase.loader.BatchLoader;
import com.yunhwan.catalog.usecase.loader.config.BatchLoaderProperties;
import com.yunhwan.catalog.usecase.projection.port.ProductViewStore;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static com.yunhwan.catalog.infra.metrics.MetricsConfig.METRIC_LOADER_BATCH;

/**
 * sku → ProductView 로더. 요청(조회 1회)마다 새로 만든다. 로더 캐시가 요청 경계를 넘지 않게 하기 위함.
 */
@Component
public class ProductBatchLoaderFactory {

    public static final String TICK_EXECUTOR = "loaderTickExecutor";

    private final ProductViewStore productViewStore;
    private final Executor tickExecutor;
    private final int maxBatchSize;
    private final DistributionSummary batchSizes;

    public ProductBatchLoaderFactory(
            ProductViewStore productViewStore,
            @Qualifier(TICK_EXECUTOR) Executor tickExecutor,
            BatchLoaderProperties props,
            MeterRegistry meterRegistry
    ) {
        this.productViewStore = productViewStore;
        this.tickExecutor = tickExecutor;
        this.maxBatchSize = props.getMaxBatchSize();
        this.batchSizes = DistributionSummary.builder(METRIC_LOADER_BATCH)
                .tag("loader", "productBySku")
                .register(meterRegistry);
    }

    public BatchLoader<String, ProductView> create() {
        return new BatchLoader<>(this::fetchBySkus, tickExecutor, maxBatchSize, batchSizes::record);
    }

    private Map<String, ProductView> fetchBySkus(List<String> skus) {
        Map<String, ProductView> out = new LinkedHashMap<>();
        for (ProductView view : productViewStore.findAllBySkus(skus)) {
            if (!view.deleted() && view.sku() != null) {
                out.put(view.sku(), view);
            }
        }
        return out;
    }
}
