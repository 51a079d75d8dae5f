package com.poolradar.cache;

import com.fasterxml.jackson.databind.JavaType;

import java.util.Optional;

/**
 * Optional persistent copy of cached responses so they survive a process restart. Implementations
 * must not throw: a mirror problem degrades to a miss.
 */
public interface CacheMirror {

    CacheMirror NONE = new CacheMirror() {
        @Override
        public <T> Optional<MirroredValue<T>> load(String fingerprint, JavaType type) {
            return Optional.empty();
        }

        @Override
        public void store(String fingerprint, Object value) {
        }
    };

    /**
     * Fresh value for the fingerprint decoded as {@code type}, or empty when absent, stale or unreadable.
     */
    <T> Optional<MirroredValue<T>> load(String fingerprint, JavaType type);

    void store(String fingerprint, Object value);
}
