package com.yunhwan.catalog.usecase.command.handler;

import com.yunhwan.catalog.common.exception.CommandValidationException;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.yunhwan.catalog.domain.product.ProductFields.*;
import static com.yunhwan.catalog.testsupport.fixtures.ProductFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CreateProductHandlerTest {

    private final CreateProductHandler handler = new CreateProductHandler(FIXED_CLOCK);

    @Test
    @DisplayName("유효한 payload → version 1 Created 이벤트 하나, 가격은 소수 둘째 자리로 정규화")
    void 유효한_생성_요청() {
        Map<String, Object> p = validCreatePayload("br-001");
        p.put(IMAGES, List.of("a.png", "b.png"));
        p.put(INVENTORY, 12);
        p.put(COMPARE_PRICE, 99);

        List<DomainEvent> events = handler.handle(createProduct(p));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.is(EventType.PRODUCT_CREATED)).isTrue();
            assertThat(e.version()).isEqualTo(1);
            assertThat(e.aggregateType()).isEqualTo(AGGREGATE_TYPE);
            assertThat(e.aggregateId()).hasSize(36);
            assertThat(e.payload().get(PRODUCT_ID)).isEqualTo(e.aggregateId());
            assertThat(e.payload().get(PRICE)).isEqualTo(new BigDecimal("79.99"));
            assertThat(e.payload().get(COMPARE_PRICE)).isEqualTo(new BigDecimal("99.00"));
            assertThat(e.payload().get(INVENTORY)).isEqualTo(12);
            assertThat(e.userId()).isEqualTo(USER);
            assertThat(e.correlationId()).isNotBlank();
        });
    }

    @Test
    @DisplayName("생성할 때마다 새 aggregate id")
    void 매번_새_aggregate() {
        String a = handler.handle(createProduct(validCreatePayload("br-001"))).get(0).aggregateId();
        String b = handler.handle(createProduct(validCreatePayload("br-001"))).get(0).aggregateId();

        assertThat(a).isNotEqualTo(b);
    }

    @ParameterizedTest
    @ValueSource(strings = {"invalid_sku", "BR-001", "b-001", "abcdef-001", "br-01", "br-0001", "br001"})
    @DisplayName("sku 형식 위반")
    void sku_형식_위반(String sku) {
        assertViolations(validCreatePayload(sku), "sku");
    }

    @ParameterizedTest
    @ValueSource(strings = {"br-001", "ab-000", "abcde-999"})
    @DisplayName("sku 형식 통과")
    void sku_형식_통과(String sku) {
        assertThatCode(() -> handler.handle(createProduct(validCreatePayload(sku)))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("가격 경계: 0과 100000은 통과, 100000.01과 음수는 거절")
    void 가격_경계() {
        for (Object ok : List.of(0, 100_000, new BigDecimal("100000.00"))) {
            Map<String, Object> p = validCreatePayload("br-001");
            p.put(PRICE, ok);
            assertThatCode(() -> handler.handle(createProduct(p))).doesNotThrowAnyException();
        }
        for (Object bad : List.of(150_000, new BigDecimal("100000.01"), -0.01, "79.99", Double.NaN)) {
            Map<String, Object> p = validCreatePayload("br-001");
            p.put(PRICE, bad);
            assertViolations(p, "price");
        }
    }

    @Test
    @DisplayName("name은 필수, 공백 불가, 200자 이하")
    void name_규칙() {
        Map<String, Object> blank = validCreatePayload("br-001");
        blank.put(NAME, "   ");
        assertViolations(blank, "name");

        Map<String, Object> tooLong = validCreatePayload("br-001");
        tooLong.put(NAME, "x".repeat(201));
        assertViolations(tooLong, "name");

        Map<String, Object> max = validCreatePayload("br-001");
        max.put(NAME, "x".repeat(200));
        assertThatCode(() -> handler.handle(createProduct(max))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("선택 필드 규칙: description, images, collection, inventory, comparePrice")
    void 선택_필드_규칙() {
        Map<String, Object> p = validCreatePayload("br-001");
        p.put(DESCRIPTION, "d".repeat(5_001));
        p.put(IMAGES, Collections.nCopies(21, "x.png"));
        p.put(COLLECTION, "c".repeat(101));
        p.put(INVENTORY, 1.5);
        p.put(COMPARE_PRICE, -1);

        assertViolations(p, "comparePrice", "description", "images", "collection", "inventory");
    }

    @Test
    @DisplayName("inventory는 int 범위를 넘으면 거절되고, 정수로 표현된 실수는 int로 저장된다")
    void inventory_int_범위() {
        Map<String, Object> overflow = validCreatePayload("br-001");
        overflow.put(INVENTORY, 3_000_000_000L);
        assertViolations(overflow, "inventory");

        Map<String, Object> max = validCreatePayload("br-001");
        max.put(INVENTORY, (long) Integer.MAX_VALUE);
        assertThat(handler.handle(createProduct(max))).singleElement()
                .satisfies(e -> assertThat(e.payload().get(INVENTORY)).isEqualTo(Integer.MAX_VALUE));

        Map<String, Object> whole = validCreatePayload("br-001");
        whole.put(INVENTORY, 7.0);
        assertThat(handler.handle(createProduct(whole))).singleElement()
                .satisfies(e -> assertThat(e.payload().get(INVENTORY)).isEqualTo(7));
    }

    @Test
    @DisplayName("위반은 첫 번째에서 멈추지 않고 전부 모아서 던진다")
    void 위반_전부_수집() {
        Map<String, Object> p = new HashMap<>();
        p.put(SKU, "invalid_sku");
        p.put(PRICE, 150_000);

        assertViolations(p, "sku", "name", "price");
    }

    private void assertViolations(Map<String, Object> payload, String... fields) {
        assertThatThrownBy(() -> handler.handle(createProduct(payload)))
                .isInstanceOfSatisfying(CommandValidationException.class, e -> {
                    assertThat(e.getViolations()).hasSize(fields.length);
                    for (int i = 0; i < fields.length; i++) {
                        assertThat(e.getViolations().get(i)).startsWith(fields[i] + ":");
                    }
                });
    }
}
