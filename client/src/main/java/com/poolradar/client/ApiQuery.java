package com.poolradar.client;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional query parameters accepted by the list and OHLCV endpoints. Unset fields are not sent.
 */
@Builder(toBuilder = true)
public record ApiQuery(
        Integer page,
        Integer limit,
        String sort,
        String orderBy,
        String start,
        String end,
        String interval,
        Boolean inversed,
        String cursor,
        Boolean reorder,
        String address
) {

    private static final ApiQuery EMPTY = ApiQuery.builder().build();

    public static ApiQuery empty() {
        return EMPTY;
    }

    public static ApiQuery ofLimit(int limit) {
        return ApiQuery.builder().limit(limit).build();
    }

    public Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        putIfSet(params, "page", page);
        putIfSet(params, "limit", limit);
        putIfSet(params, "sort", sort);
        putIfSet(params, "order_by", orderBy);
        putIfSet(params, "start", start);
        putIfSet(params, "end", end);
        putIfSet(params, "interval", interval);
        putIfSet(params, "inversed", inversed);
        putIfSet(params, "cursor", cursor);
        putIfSet(params, "reorder", reorder);
        putIfSet(params, "address", address);
        return Collections.unmodifiableMap(params);
    }

    private static void putIfSet(Map<String, String> params, String key, Object value) {
        if (value != null && !value.toString().isBlank()) {
            params.put(key, value.toString());
        }
    }
}
