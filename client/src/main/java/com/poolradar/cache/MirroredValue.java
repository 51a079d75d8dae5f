package com.poolradar.cache;

import java.time.Instant;

/**
 * Value read back from a {@link CacheMirror} with the time it was originally captured.
 */
public record MirroredValue<T>(T value, Instant capturedAt) {
}
