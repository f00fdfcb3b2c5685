package com.example.gateway.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * String key-value capability backing status records, the idempotency cache and rate counters.
 * Single-key operations are atomic on the store side; callers take no client-side locks.
 * Every method throws {@link StoreUnavailableException} when the store cannot be reached.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    /** SET with expiry, replacing any existing value and TTL. */
    void set(String key, String value, Duration ttl);

    /**
     * Atomic INCR that also sets {@code ttl} when the increment created the key, or when the key
     * has no expiry. A missing key starts at 0. Returns the value after increment.
     */
    long incrementWithExpiry(String key, Duration ttl);

    boolean delete(String key);

    /** Keys matching a glob pattern, collected with a non-blocking cursor scan. */
    List<String> scanKeys(String pattern);

    boolean ping();
}
