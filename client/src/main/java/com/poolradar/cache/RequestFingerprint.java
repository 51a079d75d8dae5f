package com.poolradar.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Deterministic cache key for one request: MD5 hex of {@code endpoint?k1=v1&k2=v2} with pairs sorted,
 * so parameter order never changes the key. Null values are dropped.
 */
public final class RequestFingerprint {

    private RequestFingerprint() {
    }

    public static String of(String endpoint, Map<String, String> params) {
        return DigestUtils.md5DigestAsHex(canonical(endpoint, params).getBytes(StandardCharsets.UTF_8));
    }

    static String canonical(String endpoint, Map<String, String> params) {
        String path = endpoint == null ? "" : endpoint;
        if (params == null || params.isEmpty()) {
            return path;
        }
        String query = params.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null)
                .map(e -> e.getKey() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining("&"));
        return query.isEmpty() ? path : path + "?" + query;
    }
}
