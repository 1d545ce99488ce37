package com.rpcgateway.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rpcgateway.node.Group;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;

/**
 * Fixed-window limits per caller identity, one resilience4j limiter per bucket. A bucket is
 * (identity, method) for methods with their own quota, (identity, group) otherwise.
 * Limiters live in a Caffeine cache expiring after inactivity, so idle callers do not pile up.
 * <p>
 * A quota of 0 rejects every call of its bucket.
 */
@Slf4j
public class CaffeineRateLimitRegistry implements RateLimitRegistry {

    private static final String DEFAULT_BUCKET = "default";

    private final String name;
    private final int defaultPermitsPerSecond;
    private final Map<String, Integer> methodPermitsPerSecond;
    private final Cache<String, RateLimiter> limiters;

    /**
     * @param name                    registry name, used in limiter names and logs (e.g. "cfx")
     * @param defaultPermitsPerSecond quota per identity and group
     * @param methodPermitsPerSecond  quota per identity for specific methods
     * @param expireAfterAccess       drop limiters of identities idle for this long
     * @param maxIdentities           upper bound of cached limiters
     */
    public CaffeineRateLimitRegistry(String name, int defaultPermitsPerSecond, Map<String, Integer> methodPermitsPerSecond,
                                     Duration expireAfterAccess, long maxIdentities) {
        if (defaultPermitsPerSecond < 0) {
            throw new IllegalArgumentException("defaultPermitsPerSecond must not be negative");
        }
        this.name = name;
        this.defaultPermitsPerSecond = defaultPermitsPerSecond;
        this.methodPermitsPerSecond = Map.copyOf(methodPermitsPerSecond);
        this.limiters = Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccess)
                .maximumSize(maxIdentities)
                .build();
    }

    @Override
    public boolean tryAcquire(String identity, String method, Group group) {
        Integer methodQuota = methodPermitsPerSecond.get(method);
        int quota = methodQuota != null ? methodQuota : defaultPermitsPerSecond;
        if (quota <= 0) {
            log.debug("Rate limit {} rejects {} for {}: zero quota", name, method, identity);
            return false;
        }
        String bucket = methodQuota != null ? method : (group != null ? group.name() : DEFAULT_BUCKET);
        String key = identity + "|" + bucket;
        RateLimiter limiter = limiters.get(key, k -> RateLimiter.of(name + ":" + k, config(quota)));
        boolean acquired = limiter.acquirePermission();
        if (!acquired) {
            log.debug("Rate limit {} exceeded for {} on bucket {}", name, identity, bucket);
        }
        return acquired;
    }

    long cachedLimiters() {
        limiters.cleanUp();
        return limiters.estimatedSize();
    }

    private static RateLimiterConfig config(int permitsPerSecond) {
        return RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(permitsPerSecond)
                .timeoutDuration(Duration.ZERO)
                .build();
    }
}
