package com.poolradar.domain;

/**
 * Headline volume for one network inside a market overview.
 */
public record NetworkSnapshot(String displayName, double totalVolume, int poolCount) {
}
