package com.yunhwan.catalog.usecase.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.TreeMap;

/**
 * 이름 있는 인자 → 결정적 캐시 키.
 *
 * 인자 순서와 무관하게 같은 키가 나오도록 모든 레벨의 map 키를 정렬해 직렬화하고,
 * SHA-256 전체(64 hex)를 쓴다. 짧게 자르지 않는다.
 */
public final class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public String digest(Map<String, ?> args) {
        Map<String, Object> sorted = new TreeMap<>();
        if (args != null) {
            args.forEach(sorted::put);
        }
        return sha256Hex(canonicalJson(sorted));
    }

    String canonicalJson(Map<String, Object> sorted) {
        try {
            return canonicalMapper.writeValueAsString(sorted);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cache key arguments are not serializable. keys=" + sorted.keySet(), e);
        }
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(dig.length * 2);
            for (byte b : dig) hex.append(String.format("%02x", b));
            return hex.toString();
        } catch (Exception e) {
            throw new IllegalStateException("sha256 compute failed", e);
        }
    }
}
