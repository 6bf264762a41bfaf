package com.yunhwan.catalog.infra.bootstrap;

import com.yunhwan.catalog.domain.command.CommandType;
import com.yunhwan.catalog.domain.query.QueryType;
import com.yunhwan.catalog.usecase.command.CommandBus;
import com.yunhwan.catalog.usecase.command.CommandHandler;
import com.yunhwan.catalog.usecase.command.handler.AdjustProductInventoryHandler;
import com.yunhwan.catalog.usecase.command.handler.ChangeProductPriceHandler;
import com.yunhwan.catalog.usecase.command.handler.CreateProductHandler;
import com.yunhwan.catalog.usecase.command.handler.DeleteProductHandler;
import com.yunhwan.catalog.usecase.projection.ProductCacheInvalidationHandler;
import com.yunhwan.catalog.usecase.projection.ProductProjectionHandler;
import com.yunhwan.catalog.usecase.query.QueryBus;
import com.yunhwan.catalog.usecase.query.QueryHandler;
import com.yunhwan.catalog.usecase.query.handler.GetProductQueryHandler;
import com.yunhwan.catalog.usecase.query.handler.GetProductsBySkuQueryHandler;
import com.yunhwan.catalog.usecase.query.handler.ListProductsByCollectionQueryHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 기동 시 handler 등록 + projection 구독.
 * switch에 default가 없으므로 enum에 타입을 추가하고 여기서 빼먹으면 컴파일이 깨진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogBusInitializer {

    private final CommandBus commandBus;
    private final QueryBus queryBus;

    private final CreateProductHandler createProductHandler;
    private final ChangeProductPriceHandler changeProductPriceHandler;
    private final AdjustProductInventoryHandler adjustProductInventoryHandler;
    private final DeleteProductHandler deleteProductHandler;

    private final GetProductQueryHandler getProductQueryHandler;
    private final GetProductsBySkuQueryHandler getProductsBySkuQueryHandler;
    private final ListProductsByCollectionQueryHandler listProductsByCollectionQueryHandler;

    private final ProductProjectionHandler productProjectionHandler;
    private final ProductCacheInvalidationHandler productCacheInvalidationHandler;

    @PostConstruct
    public void init() {
        for (CommandType type : CommandType.values()) {
            commandBus.registerHandler(type, commandHandlerFor(type));
        }
        for (QueryType type : QueryType.values()) {
            queryBus.registerHandler(type, queryHandlerFor(type));
        }

        // 순서 중요: 뷰 갱신 → 캐시 무효화
        productProjectionHandler.subscribe();
        productCacheInvalidationHandler.subscribe();

        log.info("[CatalogBusInitializer] registered. commands={}, queries={}",
                CommandType.values().length, QueryType.values().length);
    }

    private CommandHandler commandHandlerFor(CommandType type) {
        return switch (type) {
            case CREATE_PRODUCT -> createProductHandler;
            case CHANGE_PRODUCT_PRICE -> changeProductPriceHandler;
            case ADJUST_PRODUCT_INVENTORY -> adjustProductInventoryHandler;
            case DELETE_PRODUCT -> deleteProductHandler;
        };
    }

    private QueryHandler<?> queryHandlerFor(QueryType type) {
        return switch (type) {
            case GET_PRODUCT -> getProductQueryHandler;
            case GET_PRODUCTS_BY_SKU -> getProductsBySkuQueryHandler;
            case LIST_PRODUCTS_BY_COLLECTION -> listProductsByCollectionQueryHandler;
        };
    }
}
