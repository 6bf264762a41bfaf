package com.yunhwan.catalog.testsupport.fixtures;

import com.yunhwan.catalog.domain.command.Command;
import com.yunhwan.catalog.domain.command.CommandType;
import com.yunhwan.catalog.domain.event.DomainEvent;
import com.yunhwan.catalog.domain.event.EventPayload;
import com.yunhwan.catalog.domain.event.EventType;
import com.yunhwan.catalog.domain.product.ProductView;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.yunhwan.catalog.domain.product.ProductFields.*;

public final class ProductFixtures {

    private ProductFixtures() {}

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
    public static final OffsetDateTime NOW = OffsetDateTime.now(FIXED_CLOCK);
    public static final String USER = "tester";

    /** 검증을 통과하는 최소 payload (수정 가능한 사본) */
    public static Map<String, Object> validCreatePayload(String sku) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(SKU, sku);
        p.put(NAME, "Black Rose Crewneck");
        p.put(PRICE, 79.99);
        return p;
    }

    public static Command createProduct(Map<String, Object> payload) {
        return Command.of(CommandType.CREATE_PRODUCT, payload, USER);
    }

    public static Command createProduct(String sku, String collection) {
        Map<String, Object> p = validCreatePayload(sku);
        p.put(COLLECTION, collection);
        return createProduct(p);
    }

    public static Command changePrice(String productId, Object newPrice) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(PRODUCT_ID, productId);
        p.put(NEW_PRICE, newPrice);
        return Command.of(CommandType.CHANGE_PRODUCT_PRICE, p, USER);
    }

    public static Command adjustInventory(String productId, Object newQuantity) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(PRODUCT_ID, productId);
        p.put(NEW_QUANTITY, newQuantity);
        return Command.of(CommandType.ADJUST_PRODUCT_INVENTORY, p, USER);
    }

    public static Command delete(String productId) {
        return Command.of(CommandType.DELETE_PRODUCT, Map.of(PRODUCT_ID, productId), USER);
    }

    public static DomainEvent created(String aggregateId, String sku, String price) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(PRODUCT_ID, aggregateId);
        p.put(SKU, sku);
        p.put(NAME, "Product " + sku);
        p.put(PRICE, new BigDecimal(price));
        p.put(COLLECTION, "black-rose");
        p.put(IMAGES, List.of("https://img.example/" + sku + ".png"));
        p.put(INVENTORY, 5);
        return event(EventType.PRODUCT_CREATED, aggregateId, EventPayload.of(p), 1);
    }

    public static DomainEvent priceChanged(String aggregateId, String newPrice, int version) {
        return event(EventType.PRODUCT_PRICE_CHANGED, aggregateId,
                EventPayload.of(Map.of(NEW_PRICE, new BigDecimal(newPrice))), version);
    }

    public static DomainEvent inventoryChanged(String aggregateId, int quantity, int version) {
        return event(EventType.PRODUCT_INVENTORY_CHANGED, aggregateId,
                EventPayload.of(Map.of(NEW_QUANTITY, quantity)), version);
    }

    public static DomainEvent deleted(String aggregateId, int version) {
        return event(EventType.PRODUCT_DELETED, aggregateId, EventPayload.empty(), version);
    }

    public static DomainEvent event(EventType type, String aggregateId, EventPayload payload, int version) {
        return DomainEvent.create(type, aggregateId, AGGREGATE_TYPE, payload, version, USER, "corr-" + version, FIXED_CLOCK);
    }

    public static DomainEvent unknown(String aggregateId, int version) {
        return new DomainEvent(UUID.randomUUID().toString(), "ProductReviewed", aggregateId, AGGREGATE_TYPE,
                EventPayload.of(Map.of("stars", 5)), NOW, version, USER, null);
    }

    public static ProductView view(String productId, String sku, String collection, String price) {
        return new ProductView(productId, sku, "Product " + sku, new BigDecimal(price), null, null,
                collection, List.of(), 3, false, 1, NOW);
    }
}
