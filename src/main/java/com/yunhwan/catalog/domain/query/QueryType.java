package com.yunhwan.catalog.domain.query;

public enum QueryType {
    GET_PRODUCT,
    GET_PRODUCTS_BY_SKU,
    LIST_PRODUCTS_BY_COLLECTION
}
