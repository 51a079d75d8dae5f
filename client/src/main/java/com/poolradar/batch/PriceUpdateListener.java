package com.poolradar.batch;

@FunctionalInterface
public interface PriceUpdateListener {

    void onUpdate(PriceUpdate update);
}
