package com.nevis.dossier.infra;

import java.util.function.Supplier;

/**
 * Per-key throttle in front of the inference provider. {@code permits} is the estimated token cost of one call.
 */
public interface RateLimiter {

    void acquire(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> call) {
        acquire(key, permits);
        return call.get();
    }
}
