package com.yunhwan.catalog.domain.product;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 조회 전용 비정규화 뷰. aggregate id 하나당 한 건.
 * version은 마지막으로 반영한 이벤트 version (멱등 가드).
 */
public record ProductView(
        String productId,
        String sku,
        String name,
        BigDecimal price,
        BigDecimal comparePrice,
        String description,
        String collection,
        List<String> images,
        int inventory,
        boolean deleted,
        long version,
        OffsetDateTime updatedAt
) {

    public ProductView {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public ProductView withPrice(BigDecimal newPrice, long version, OffsetDateTime at) {
        return new ProductView(productId, sku, name, newPrice, comparePrice, description,
                collection, images, inventory, deleted, version, at);
    }

    public ProductView withInventory(int newInventory, long version, OffsetDateTime at) {
        return new ProductView(productId, sku, name, price, comparePrice, description,
                collection, images, newInventory, deleted, version, at);
    }

    public ProductView markDeleted(long version, OffsetDateTime at) {
        return new ProductView(productId, sku, name, price, comparePrice, description,
                collection, images, inventory, true, version, at);
    }
}
