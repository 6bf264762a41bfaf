package com.yunhwan.catalog.domain.product;

/**
 * Product aggregate의 payload/상태 필드명.
 */
public final class ProductFields {

    private ProductFields() {}

    public static final String AGGREGATE_TYPE = "Product";

    public static final String PRODUCT_ID = "productId";
    public static final String SKU = "sku";
    public static final String NAME = "name";
    public static final String PRICE = "price";
    public static final String COMPARE_PRICE = "comparePrice";
    public static final String DESCRIPTION = "description";
    public static final String IMAGES = "images";
    public static final String COLLECTION = "collection";
    public static final String INVENTORY = "inventory";
    public static final String DELETED = "deleted";

    public static final String NEW_PRICE = "newPrice";
    public static final String NEW_QUANTITY = "newQuantity";
}
