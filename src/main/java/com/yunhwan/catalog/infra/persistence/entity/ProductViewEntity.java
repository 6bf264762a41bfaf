package com.yunhwan.catalog.infra.persistence.entity;

import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Entity
@Table(
        name = "product_view",
        indexes = {
                @Index(name = "ix_product_view_sku", columnList = "sku"),
                @Index(name = "ix_product_view_collection", columnList = "collection,deleted,sku")
        }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class ProductViewEntity {

    @Id
    @Column(name = "product_id", length = 100)
    private String productId;

    @Column(name = "sku", length = 20)
    private String sku;

    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "price", precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "compare_price", precision = 12, scale = 2)
    private BigDecimal comparePrice;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "collection", length = 100)
    private String collection;

    /**
     * JSON 배열 문자열 (["https://...", ...])
     */
    @Type(JsonBinaryType.class)
    @Column(name = "images", nullable = false, columnDefinition = "jsonb")
    private String images;

    @Column(name = "inventory", nullable = false)
    private int inventory;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    /**
     * 마지막으로 반영한 이벤트 version. 낙관적 락(@Version)이 아니다.
     */
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public static ProductViewEntity of(
            String productId,
            String sku,
            String name,
            BigDecimal price,
            BigDecimal comparePrice,
            String description,
            String collection,
            String imagesJson,
            int inventory,
            boolean deleted,
            long version,
            OffsetDateTime updatedAt
    ) {
        ProductViewEntity e = new ProductViewEntity();
        e.productId = productId;
        e.sku = sku;
        e.name = name;
        e.price = price;
        e.comparePrice = comparePrice;
        e.description = description;
        e.collection = collection;
        e.images = imagesJson;
        e.inventory = inventory;
        e.deleted = deleted;
        e.version = version;
        e.updatedAt = updatedAt;
        return e;
    }
}
