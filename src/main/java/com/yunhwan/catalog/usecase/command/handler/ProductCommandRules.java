package com.yunhwan.catalog.usecase.command.handler;

import com.yunhwan.catalog.common.exception.CommandValidationException;
import com.yunhwan.catalog.domain.command.Command;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.yunhwan.catalog.domain.product.ProductFields.*;

/**
 * Product command 공통 검증. 첫 위반에서 멈추지 않고 전부 모은 뒤 한 번에 던진다.
 */
final class ProductCommandRules {

    static final Pattern SKU_PATTERN = Pattern.compile("^[a-z]{2,5}-\\d{3}$");
    static final int NAME_MAX = 200;
    static final int DESCRIPTION_MAX = 5_000;
    static final int COLLECTION_MAX = 100;
    static final int IMAGES_MAX = 20;
    static final BigDecimal PRICE_MAX = new BigDecimal("100000");
    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

    private final Command command;
    private final Map<String, Object> payload;
    private final List<String> violations = new ArrayList<>();

    private ProductCommandRules(Command command) {
        this.command = command;
        this.payload = command.payload();
    }

    static ProductCommandRules of(Command command) {
        return new ProductCommandRules(command);
    }

    ProductCommandRules sku() {
        Object v = payload.get(SKU);
        if (!(v instanceof String s) || !SKU_PATTERN.matcher(s).matches()) {
            violations.add(SKU + ": must match " + SKU_PATTERN.pattern());
        }
        return this;
    }

    ProductCommandRules name() {
        Object v = payload.get(NAME);
        if (!(v instanceof String s) || s.isBlank()) {
            violations.add(NAME + ": required");
        } else if (s.length() > NAME_MAX) {
            violations.add(NAME + ": max length " + NAME_MAX);
        }
        return this;
    }

    ProductCommandRules price(String field) {
        Object v = payload.get(field);
        if (!isNumber(v)) {
            violations.add(field + ": must be a number");
            return this;
        }
        BigDecimal p = new BigDecimal(v.toString());
        if (p.signum() < 0 || p.compareTo(PRICE_MAX) > 0) {
            violations.add(field + ": must be between 0 and " + PRICE_MAX);
        }
        return this;
    }

    ProductCommandRules optionalNonNegativeNumber(String field) {
        Object v = payload.get(field);
        if (v == null) return this;
        if (!isNumber(v) || new BigDecimal(v.toString()).signum() < 0) {
            violations.add(field + ": must be a number >= 0");
        }
        return this;
    }

    ProductCommandRules optionalMaxLength(String field, int max) {
        Object v = payload.get(field);
        if (v == null) return this;
        if (!(v instanceof String s)) {
            violations.add(field + ": must be a string");
        } else if (s.length() > max) {
            violations.add(field + ": max length " + max);
        }
        return this;
    }

    ProductCommandRules optionalImages() {
        Object v = payload.get(IMAGES);
        if (v == null) return this;
        if (!(v instanceof Collection<?> c)) {
            violations.add(IMAGES + ": must be a list");
        } else if (c.size() > IMAGES_MAX) {
            violations.add(IMAGES + ": max " + IMAGES_MAX + " entries");
        }
        return this;
    }

    ProductCommandRules nonNegativeInteger(String field, boolean required) {
        Object v = payload.get(field);
        if (v == null) {
            if (required) violations.add(field + ": required");
            return this;
        }
        if (!isInteger(v) || new BigDecimal(v.toString()).signum() < 0) {
            violations.add(field + ": must be an integer >= 0");
        } else if (new BigDecimal(v.toString()).compareTo(INT_MAX) > 0) {
            violations.add(field + ": must be <= " + Integer.MAX_VALUE);
        }
        return this;
    }

    /**
     * {@link #nonNegativeInteger} 통과 후에만 호출. 범위 밖이면 ArithmeticException.
     */
    static int toInt(Object v) {
        return new BigDecimal(v.toString()).intValueExact();
    }

    ProductCommandRules productId() {
        Object v = payload.get(PRODUCT_ID);
        if (!(v instanceof String s) || s.isBlank()) {
            violations.add(PRODUCT_ID + ": required");
        }
        return this;
    }

    void validate() {
        if (!violations.isEmpty()) {
            throw new CommandValidationException(command.type() + " rejected.", violations);
        }
    }

    private static boolean isNumber(Object v) {
        if (!(v instanceof Number n)) return false;
        if (n instanceof Double d) return !d.isNaN() && !d.isInfinite();
        if (n instanceof Float f) return !f.isNaN() && !f.isInfinite();
        return true;
    }

    private static boolean isInteger(Object v) {
        if (!isNumber(v)) return false;
        return new BigDecimal(v.toString()).stripTrailingZeros().scale() <= 0;
    }
}
