package com.yunhwan.catalog.usecase.command.handler;

import com.yunhwan.catalog.common.exception.CommandValidationException;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.testsupport.fixtures.CatalogTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.yunhwan.catalog.domain.product.ProductFields.NEW_PRICE;
import static com.yunhwan.catalog.domain.product.ProductFields.NEW_QUANTITY;
import static com.yunhwan.catalog.testsupport.fixtures.ProductFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 가격 변경 / 재고 조정 / 삭제. 모두 원장 재생으로 존재 여부를 확인하고 다음 version으로 이벤트를 만든다.
 */
@Tag("unit")
class ProductMutationHandlersTest {

    CatalogTestContext ctx;
    ChangeProductPriceHandler changePrice;
    AdjustProductInventoryHandler adjustInventory;
    DeleteProductHandler delete;

    @BeforeEach
    void setUp() {
        ctx = new CatalogTestContext();
        changePrice = new ChangeProductPriceHandler(ctx.aggregateReader, FIXED_CLOCK);
        adjustInventory = new AdjustProductInventoryHandler(ctx.aggregateReader, FIXED_CLOCK);
        delete = new DeleteProductHandler(ctx.aggregateReader, FIXED_CLOCK);
        ctx.eventStore.appendAll(List.of(created("p-1", "br-001", "79.99"), inventoryChanged("p-1", 3, 2)));
    }

    @Test
    @DisplayName("가격 변경: 현재 version + 1, 새 가격은 정규화")
    void 가격_변경() {
        List<DomainEvent> events = changePrice.handle(changePrice("p-1", 89.9));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.is(EventType.PRODUCT_PRICE_CHANGED)).isTrue();
            assertThat(e.version()).isEqualTo(3);
            assertThat(e.payload().get(NEW_PRICE)).isEqualTo(new BigDecimal("89.90"));
        });
    }

    @Test
    @DisplayName("가격 변경도 생성과 같은 가격 규칙을 따른다")
    void 가격_변경_규칙() {
        assertThatThrownBy(() -> changePrice.handle(changePrice("p-1", 150_000)))
                .isInstanceOf(CommandValidationException.class)
                .hasMessageContaining("newPrice");
    }

    @Test
    @DisplayName("없는 상품은 변경할 수 없다")
    void 없는_상품() {
        assertThatThrownBy(() -> changePrice.handle(changePrice("ghost", 10)))
                .isInstanceOfSatisfying(CommandValidationException.class,
                        e -> assertThat(e.getViolations()).singleElement().asString().contains("not found"));
    }

    @Test
    @DisplayName("재고 조정: 0 이상 정수만")
    void 재고_조정() {
        assertThat(adjustInventory.handle(adjustInventory("p-1", 0)))
                .singleElement()
                .satisfies(e -> assertThat(e.payload().get(NEW_QUANTITY)).isEqualTo(0));

        assertThatThrownBy(() -> adjustInventory.handle(adjustInventory("p-1", -1)))
                .isInstanceOf(CommandValidationException.class);
        assertThatThrownBy(() -> adjustInventory.handle(adjustInventory("p-1", 2.5)))
                .isInstanceOf(CommandValidationException.class);
        assertThatThrownBy(() -> adjustInventory.handle(adjustInventory("p-1", null)))
                .isInstanceOf(CommandValidationException.class)
                .hasMessageContaining("newQuantity: required");
    }

    @Test
    @DisplayName("재고 조정: int 범위를 넘는 수량은 음수로 바뀌지 않고 거절된다")
    void 재고_조정_int_범위() {
        assertThatThrownBy(() -> adjustInventory.handle(adjustInventory("p-1", 3_000_000_000L)))
                .isInstanceOfSatisfying(CommandValidationException.class,
                        e -> assertThat(e.getViolations()).singleElement().asString().startsWith("newQuantity:"));

        assertThat(adjustInventory.handle(adjustInventory("p-1", (long) Integer.MAX_VALUE)))
                .singleElement()
                .satisfies(e -> assertThat(e.payload().get(NEW_QUANTITY)).isEqualTo(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("삭제 후에는 변경도, 재삭제도 거절된다")
    void 삭제된_상품() {
        ctx.eventStore.appendAll(delete.handle(delete("p-1")));

        assertThatThrownBy(() -> delete.handle(delete("p-1")))
                .isInstanceOf(CommandValidationException.class)
                .hasMessageContaining("already deleted");
        assertThatThrownBy(() -> changePrice.handle(changePrice("p-1", 10)))
                .isInstanceOf(CommandValidationException.class);
    }

    @Test
    @DisplayName("productId가 없으면 원장을 보기 전에 거절")
    void productId_필수() {
        assertThatThrownBy(() -> delete.handle(delete("  ")))
                .isInstanceOf(CommandValidationException.class)
                .hasMessageContaining("productId: required");
    }
}
