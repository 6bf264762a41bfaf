package com.yunhwan.catalog.domain.product;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Prices {

    private Prices() {}

    public static final int SCALE = 2;

    /**
     * 숫자 → 소수 둘째 자리 BigDecimal. double은 toString 경유로 변환해 2진 오차를 피한다.
     */
    public static BigDecimal normalize(Number n) {
        if (n == null) return null;
        BigDecimal bd = (n instanceof BigDecimal b) ? b : new BigDecimal(n.toString());
        return bd.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal fromPayload(Object v) {
        if (v == null) return null;
        if (v instanceof Number n) return normalize(n);
        return normalize(new BigDecimal(String.valueOf(v)));
    }
}
