package com.auditchain.api.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client Bucket4j buckets for the chain API.
 */
@Configuration
public class RateLimitConfig {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final long defaultPerMinute;
    private final long strictPerMinute;
    private final long highVolumePerMinute;

    public RateLimitConfig(@Value("${auditchain.rate-limit.default-per-minute:100}") long defaultPerMinute,
                           @Value("${auditchain.rate-limit.strict-per-minute:10}") long strictPerMinute,
                           @Value("${auditchain.rate-limit.high-volume-per-minute:500}") long highVolumePerMinute) {
        this.defaultPerMinute = defaultPerMinute;
        this.strictPerMinute = strictPerMinute;
        this.highVolumePerMinute = highVolumePerMinute;
    }

    /**
     * Appends and checkpoint requests.
     */
    public Bucket resolveBucket(String clientId) {
        return buckets.computeIfAbsent(clientId, key -> createBucket(defaultPerMinute));
    }

    /**
     * Verification and evidence export, which walk whole chains.
     */
    public Bucket resolveStrictBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":strict", key -> createBucket(strictPerMinute));
    }

    /**
     * Entry reads and status.
     */
    public Bucket resolveHighVolumeBucket(String clientId) {
        return buckets.computeIfAbsent(clientId + ":high", key -> createBucket(highVolumePerMinute));
    }

    private static Bucket createBucket(long perMinute) {
        Bandwidth limit = Bandwidth.classic(perMinute, Refill.greedy(perMinute, Duration.ofMinutes(1)));
        return Bucket.builder().addLimit(limit).build();
    }

    /**
     * Clear rate limit buckets for a client (for testing).
     */
    public void clearBucket(String clientId) {
        buckets.remove(clientId);
        buckets.remove(clientId + ":strict");
        buckets.remove(clientId + ":high");
    }
}
