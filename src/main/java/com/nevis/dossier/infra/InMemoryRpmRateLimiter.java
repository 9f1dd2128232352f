package com.nevis.dossier.infra;

import io.github.bucket4j.Bucket;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute only. Used for short calls such as classification, where the token estimate is noise.
 */
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        this.rpmLimit = rpmLimit;
    }

    @Override
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> InMemoryDualRateLimiter.perMinuteBucket(rpmLimit));
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit on " + key, e);
        }
    }
}
