package com.nevis.dossier.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute plus tokens-per-minute limiter, one pair of buckets per key.
 * {@link #acquire} blocks until both buckets can serve the request.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> rpmBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tpmBuckets = new ConcurrentHashMap<>();

    private final int rpmLimit;
    private final int tpmLimit;

    public InMemoryDualRateLimiter(int rpmLimit, int tpmLimit) {
        this.rpmLimit = rpmLimit;
        this.tpmLimit = tpmLimit;
    }

    static Bucket perMinuteBucket(int capacity) {
        return Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, Duration.ofMinutes(1))
                .build())
            .build();
    }

    @Override
    public void acquire(String key, int tokens) {
        Bucket rpmBucket = rpmBuckets.computeIfAbsent(key, k -> perMinuteBucket(rpmLimit));
        Bucket tpmBucket = tpmBuckets.computeIfAbsent(key, k -> perMinuteBucket(tpmLimit));

        try {
            rpmBucket.asBlocking().consume(1);
            // a single oversized request must not wait forever on a bucket it can never fit in
            tpmBucket.asBlocking().consume(Math.max(1, Math.min(tokens, tpmLimit)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit on " + key, e);
        }
    }
}
