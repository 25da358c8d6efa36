package com.tyron.nanoedit.api.history;

/**
 * Monotonic clock used for grouping decisions. Readings are only compared with each other.
 */
@FunctionalInterface
public interface TimeSource {

    long nowMillis();

    static TimeSource system() {
        return () -> System.nanoTime() / 1_000_000L;
    }
}
