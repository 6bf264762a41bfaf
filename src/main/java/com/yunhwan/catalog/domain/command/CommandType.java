package com.yunhwan.catalog.domain.command;

public enum CommandType {
    CREATE_PRODUCT,
    CHANGE_PRODUCT_PRICE,
    ADJUST_PRODUCT_INVENTORY,
    DELETE_PRODUCT
}
