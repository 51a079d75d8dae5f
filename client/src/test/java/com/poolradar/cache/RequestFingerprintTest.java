package com.poolradar.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestFingerprintTest {

    @Test
    @DisplayName("parameter order does not change the fingerprint")
    void orderIndependent() {
        Map<String, String> a = new LinkedHashMap<>();
        a.put("limit", "10");
        a.put("page", "2");
        a.put("sort", "desc");
        Map<String, String> b = new LinkedHashMap<>();
        b.put("sort", "desc");
        b.put("page", "2");
        b.put("limit", "10");

        assertThat(RequestFingerprint.of("/networks/ethereum/pools", a))
                .isEqualTo(RequestFingerprint.of("/networks/ethereum/pools", b));
    }

    @Test
    @DisplayName("canonical form is endpoint?sorted pairs")
    void canonicalForm() {
        assertThat(RequestFingerprint.canonical("/search", Map.of("query", "usdc")))
                .isEqualTo("/search?query=usdc");
        assertThat(RequestFingerprint.canonical("/pools", Map.of("page", "1", "limit", "5")))
                .isEqualTo("/pools?limit=5&page=1");
        assertThat(RequestFingerprint.canonical("/stats", Map.of())).isEqualTo("/stats");
    }

    @Test
    @DisplayName("null parameter values are dropped")
    void nullValuesDropped() {
        Map<String, String> params = new HashMap<>();
        params.put("limit", "5");
        params.put("cursor", null);
        assertThat(RequestFingerprint.canonical("/pools", params)).isEqualTo("/pools?limit=5");
    }

    @Test
    @DisplayName("different endpoints or values give different fingerprints")
    void distinct() {
        String base = RequestFingerprint.of("/networks/ethereum/pools", Map.of("limit", "10"));
        assertThat(RequestFingerprint.of("/networks/solana/pools", Map.of("limit", "10"))).isNotEqualTo(base);
        assertThat(RequestFingerprint.of("/networks/ethereum/pools", Map.of("limit", "11"))).isNotEqualTo(base);
        assertThat(base).hasSize(32).matches("[0-9a-f]+");
    }
}
