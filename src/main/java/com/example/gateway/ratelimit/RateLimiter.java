package com.example.gateway.ratelimit;

import com.example.gateway.config.RateLimitProperties;
import com.example.gateway.store.KeyValueStore;
import com.example.gateway.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Fixed-window admission control over {@code rate_limit:<identifier>} counters.
 *
 * <p>The expiry is set by the same atomic store call that opens a window, so later requests never
 * extend it and a counter is never left without one. Rejected requests still count. If the store is unreachable the limiter fails open.
 */
@Slf4j
@Component
public class RateLimiter {

    static final String KEY_PREFIX = "rate_limit:";
    private static final double WARN_RATIO = 0.8;

    private final KeyValueStore store;
    private final int defaultMaxRequests;
    private final Duration defaultWindow;

    public RateLimiter(KeyValueStore store, RateLimitProperties properties) {
        this.store = store;
        this.defaultMaxRequests = properties.maxRequests();
        this.defaultWindow = Duration.ofSeconds(properties.windowSec());
    }

    public boolean check(String identifier) {
        return check(identifier, defaultMaxRequests, defaultWindow);
    }

    public boolean check(String identifier, int maxRequests, Duration window) {
        String key = KEY_PREFIX + identifier;
        long count;
        try {
            count = store.incrementWithExpiry(key, window);
        } catch (StoreUnavailableException e) {
            log.error("event=rate_limit_fail_open identifier={} error={}", identifier, e.getMessage());
            return true;
        }

        if (count > maxRequests) {
            log.warn("event=rate_limit_exceeded identifier={} count={}/{} windowSec={}",
                    identifier, count, maxRequests, window.toSeconds());
            return false;
        }
        if (count > maxRequests * WARN_RATIO) {
            log.info("event=rate_limit_warning identifier={} count={}/{}", identifier, count, maxRequests);
        }
        return true;
    }

    /** Like {@link #check(String)} but throws instead of returning {@code false}. */
    public void enforce(String identifier) {
        if (!check(identifier)) {
            throw new RateLimitExceededException();
        }
    }

    public long remaining(String identifier) {
        try {
            long used = store.get(KEY_PREFIX + identifier).flatMap(RateLimiter::parse).orElse(0L);
            return Math.max(0, defaultMaxRequests - used);
        } catch (StoreUnavailableException e) {
            log.error("event=rate_limit_remaining_failed identifier={} error={}", identifier, e.getMessage());
            return defaultMaxRequests;
        }
    }

    public boolean reset(String identifier) {
        try {
            store.delete(KEY_PREFIX + identifier);
            log.info("event=rate_limit_reset identifier={}", identifier);
            return true;
        } catch (StoreUnavailableException e) {
            log.error("event=rate_limit_reset_failed identifier={} error={}", identifier, e.getMessage());
            return false;
        }
    }

    private static Optional<Long> parse(String raw) {
        try {
            return Optional.of(Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
