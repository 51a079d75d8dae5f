package com.poolradar.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One OHLCV candle. Slices returned by the API are ascending by {@code timeOpen}.
 */
public record OhlcvBar(
        @JsonProperty("time_open") String timeOpen,
        @JsonProperty("time_close") String timeClose,
        double open,
        double high,
        double low,
        double close,
        long volume
) {

    public double typicalPrice() {
        return (high + low + close) / 3;
    }
}
