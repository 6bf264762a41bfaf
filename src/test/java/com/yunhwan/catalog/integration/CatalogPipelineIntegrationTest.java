package com.yunhwan.catalog.integration;

import com.yunhwan.catalog.common.exception.CommandValidationException;
import com.yunhwan.catalog.common.exception.EventPersistenceException;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.product.ProductView;
import com.yunhwan.catalog.domain.query.Query;
import com.yunhwan.catalog.domain.query.QueryType;
import com.yunhwan.catalog.testsupport.base.AbstractIntegrationTest;
import com.yunhwan.catalog.usecase.command.CommandBus;
import com.yunhwan.catalog.usecase.event.EventBus;
import com.yunhwan.catalog.usecase.event.EventStore;
import com.yunhwan.catalog.usecase.projection.ProductProjectionHandler;
import com.yunhwan.catalog.usecase.query.QueryBus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

import static com.yunhwan.catalog.domain.product.ProductFields.*;
import static com.yunhwan.catalog.testsupport.fixtures.ProductFixtures.*;
import static com.yunhwan.catalog.usecase.product.ProductReadCaches.ARG_COLLECTION;
import static com.yunhwan.catalog.usecase.query.handler.GetProductsBySkuQueryHandler.FILTER_SKUS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * command -> event_store(jsonb) -> projection(product_view) -> query(Caffeine + Redis) 전체 흐름.
 * 컨텍스트가 테스트 간 공유되므로 sku/collection은 매번 새로 만든다.
 */
@DisplayName("카탈로그 파이프라인 통합 테스트")
class CatalogPipelineIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    CommandBus commandBus;

    @Autowired
    QueryBus queryBus;

    @Autowired
    EventStore eventStore;

    @Autowired
    EventBus eventBus;

    @Autowired
    ProductProjectionHandler projection;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("생성한 상품을 GET_PRODUCT로 조회하면 projection 결과가 보인다")
    void 생성_후_단건_조회() {
        // Given
        String sku = randomSku();

        // When
        List<DomainEvent> events = commandBus.execute(createProduct(sku, randomCollection()));
        String productId = events.get(0).aggregateId();

        // Then
        Optional<ProductView> view = queryBus.execute(Query.of(QueryType.GET_PRODUCT, Map.of(PRODUCT_ID, productId)));
        assertThat(view).isPresent();
        assertThat(view.get().sku()).isEqualTo(sku);
        assertThat(view.get().price()).isEqualByComparingTo("79.99");
        assertThat(view.get().version()).isEqualTo(1);
        assertThat(countRows("product_view", productId)).isEqualTo(1L);
        assertThat(eventBus.deadLetterCount()).isZero();
    }

    @Test
    @DisplayName("jsonb payload의 가격은 BigDecimal로 되읽힌다")
    void payload_가격_정밀도() {
        String productId = commandBus.execute(createProduct(randomSku(), randomCollection())).get(0).aggregateId();

        DomainEvent stored = eventStore.getEvents(productId).get(0);

        assertThat(stored.payload().get(PRICE)).isInstanceOf(BigDecimal.class);
        assertThat((BigDecimal) stored.payload().get(PRICE)).isEqualByComparingTo("79.99");
        assertThat(stored.payload().get(INVENTORY)).isEqualTo(0);
    }

    @Test
    @DisplayName("가격 변경 후 단건/목록 조회 모두 새 가격을 돌려준다")
    void 쓰기_후_캐시_무효화() {
        // Given: 조회로 캐시를 채워 둔다
        String collection = randomCollection();
        String productId = commandBus.execute(createProduct(randomSku(), collection)).get(0).aggregateId();
        queryBus.execute(Query.of(QueryType.GET_PRODUCT, Map.of(PRODUCT_ID, productId)));
        queryBus.execute(Query.of(QueryType.LIST_PRODUCTS_BY_COLLECTION, Map.of(ARG_COLLECTION, collection)));

        // When
        commandBus.execute(changePrice(productId, 59.5));

        // Then
        Optional<ProductView> view = queryBus.execute(Query.of(QueryType.GET_PRODUCT, Map.of(PRODUCT_ID, productId)));
        List<ProductView> listed = queryBus.execute(
                Query.of(QueryType.LIST_PRODUCTS_BY_COLLECTION, Map.of(ARG_COLLECTION, collection)));

        assertThat(view).get().extracting(ProductView::price).isEqualTo(new BigDecimal("59.50"));
        assertThat(listed).singleElement().extracting(ProductView::price).isEqualTo(new BigDecimal("59.50"));
    }

    @Test
    @DisplayName("삭제된 상품은 단건/목록/sku 조회에서 모두 빠진다")
    void 삭제_후_조회() {
        String collection = randomCollection();
        String sku = randomSku();
        String productId = commandBus.execute(createProduct(sku, collection)).get(0).aggregateId();

        commandBus.execute(delete(productId));

        Optional<ProductView> view = queryBus.execute(Query.of(QueryType.GET_PRODUCT, Map.of(PRODUCT_ID, productId)));
        List<ProductView> listed = queryBus.execute(
                Query.of(QueryType.LIST_PRODUCTS_BY_COLLECTION, Map.of(ARG_COLLECTION, collection)));
        List<Optional<ProductView>> bySku = queryBus.execute(
                Query.of(QueryType.GET_PRODUCTS_BY_SKU, Map.of(FILTER_SKUS, List.of(sku))));

        assertThat(view).isEmpty();
        assertThat(listed).isEmpty();
        assertThat(bySku).containsExactly(Optional.empty());
        assertThat(eventStore.currentVersion(productId)).isEqualTo(2);
    }

    @Test
    @DisplayName("sku 배치 조회는 요청 순서를 유지하고 없는 sku는 empty로 채운다")
    void sku_배치_조회() {
        String skuA = randomSku();
        String skuB = randomSku();
        commandBus.execute(createProduct(skuA, randomCollection()));
        commandBus.execute(createProduct(skuB, randomCollection()));

        List<Optional<ProductView>> result = queryBus.execute(
                Query.of(QueryType.GET_PRODUCTS_BY_SKU, Map.of(FILTER_SKUS, List.of(skuB, "zz-000", skuA, skuB))));

        assertThat(result).hasSize(4);
        assertThat(result.get(0)).get().extracting(ProductView::sku).isEqualTo(skuB);
        assertThat(result.get(1)).isEmpty();
        assertThat(result.get(2)).get().extracting(ProductView::sku).isEqualTo(skuA);
        assertThat(result.get(3)).isEqualTo(result.get(0));
    }

    @Test
    @DisplayName("같은 aggregate에 같은 version을 다시 append하면 유니크 제약으로 거부된다")
    void 버전_충돌() {
        String productId = commandBus.execute(createProduct(randomSku(), randomCollection())).get(0).aggregateId();

        assertThatThrownBy(() -> eventStore.append(priceChanged(productId, "10.00", 1)))
                .isInstanceOf(EventPersistenceException.class);

        assertThat(eventStore.getEvents(productId)).hasSize(1);
        assertThat(countRows("event_store", productId)).isEqualTo(1L);
    }

    @Test
    @DisplayName("노드 시계가 어긋나 occurredAt이 역전돼도 이력/replay는 version 순서를 따른다")
    void 시계_역전_시_version_순서() {
        // Given: v2가 v1보다 이른 벽시계 시각을 가진다
        String productId = "skew-" + UUID.randomUUID();
        DomainEvent v1 = created(productId, randomSku(), "79.99");
        DomainEvent v2 = priceChanged(productId, "89.99", 2);
        DomainEvent v2Skewed = new DomainEvent(v2.eventId(), v2.eventType(), v2.aggregateId(), v2.aggregateType(),
                v2.payload(), v1.occurredAt().minusNanos(30_000_000), v2.version(), v2.userId(), v2.correlationId());

        // When
        eventStore.append(v1);
        eventStore.append(v2Skewed);

        // Then
        assertThat(eventStore.getEvents(productId)).extracting(DomainEvent::version).containsExactly(1, 2);
        assertThat((BigDecimal) eventStore.replay(productId).get(PRICE)).isEqualByComparingTo("89.99");
        assertThat(projection.rebuild(productId)).get()
                .extracting(ProductView::price).isEqualTo(new BigDecimal("89.99"));
    }

    @Test
    @DisplayName("검증 실패한 command는 event_store에 아무것도 남기지 않는다")
    void 검증_실패는_저장_없음() {
        Long before = jdbcTemplate.queryForObject("select count(*) from event_store", Long.class);

        assertThatThrownBy(() -> commandBus.execute(createProduct(Map.of(SKU, "BAD", NAME, ""))))
                .isInstanceOf(CommandValidationException.class);

        Long after = jdbcTemplate.queryForObject("select count(*) from event_store", Long.class);
        assertThat(after).isEqualTo(before);
    }

    @Test
    @DisplayName("product_view 행이 사라져도 rebuild로 event_store에서 복구된다")
    void rebuild_복구() {
        String productId = commandBus.execute(createProduct(randomSku(), randomCollection())).get(0).aggregateId();
        commandBus.execute(adjustInventory(productId, 42));
        jdbcTemplate.update("delete from product_view where product_id = ?", productId);

        Optional<ProductView> rebuilt = projection.rebuild(productId);

        assertThat(rebuilt).isPresent();
        assertThat(rebuilt.get().inventory()).isEqualTo(42);
        assertThat(rebuilt.get().version()).isEqualTo(2);
    }

    private long countRows(String table, String id) {
        String column = table.equals("event_store") ? "aggregate_id" : "product_id";
        Long count = jdbcTemplate.queryForObject(
                "select count(*) from " + table + " where " + column + " = ?", Long.class, id);
        return count == null ? 0L : count;
    }

    private static String randomSku() {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        StringBuilder letters = new StringBuilder();
        for (int i = 0; i < 5; i++) {
            letters.append((char) ('a' + r.nextInt(26)));
        }
        return letters + "-" + String.format("%03d", r.nextInt(1000));
    }

    private static String randomCollection() {
        return "col-" + UUID.randomUUID();
    }
}
