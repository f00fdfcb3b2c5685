package com.example.gateway.support;

import com.example.gateway.store.KeyValueStore;
import com.example.gateway.store.StoreUnavailableException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Redis stand-in with expiry driven by a {@link Clock}. {@link #setAvailable(boolean)} simulates an outage.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Entry(String value, Instant expiresAt) {}

    private final Map<String, Entry> entries = new HashMap<>();
    private final Clock clock;
    private boolean available = true;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    /** Remaining time to live, empty for a missing key or one without expiry. */
    public synchronized Optional<Duration> ttl(String key) {
        Entry entry = live(key);
        if (entry == null || entry.expiresAt() == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(clock.instant(), entry.expiresAt()));
    }

    public synchronized int size() {
        purgeExpired();
        return entries.size();
    }

    @Override
    public synchronized Optional<String> get(String key) {
        checkAvailable();
        Entry entry = live(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        checkAvailable();
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    /** Stores a value with no expiry, like a plain SET. */
    public synchronized void putWithoutExpiry(String key, String value) {
        entries.put(key, new Entry(value, null));
    }

    @Override
    public synchronized long incrementWithExpiry(String key, Duration ttl) {
        checkAvailable();
        Entry entry = live(key);
        long next = entry == null ? 1 : Long.parseLong(entry.value()) + 1;
        Instant expiresAt = entry == null || entry.expiresAt() == null
                ? clock.instant().plus(ttl)
                : entry.expiresAt();
        entries.put(key, new Entry(Long.toString(next), expiresAt));
        return next;
    }

    @Override
    public synchronized boolean delete(String key) {
        checkAvailable();
        return entries.remove(key) != null;
    }

    @Override
    public synchronized List<String> scanKeys(String pattern) {
        checkAvailable();
        purgeExpired();
        Pattern regex = Pattern.compile(Pattern.quote(pattern).replace("*", "\\E.*\\Q"));
        return entries.keySet().stream()
                .filter(k -> regex.matcher(k).matches())
                .sorted()
                .toList();
    }

    @Override
    public boolean ping() {
        checkAvailable();
        return true;
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAt() != null && !clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void purgeExpired() {
        Instant now = clock.instant();
        entries.values().removeIf(e -> e.expiresAt() != null && !now.isBefore(e.expiresAt()));
    }

    private void checkAvailable() {
        if (!available) {
            throw new StoreUnavailableException("store offline", null);
        }
    }
}
