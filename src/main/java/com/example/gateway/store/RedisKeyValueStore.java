package com.example.gateway.store;

import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private static final int SCAN_BATCH = 100;

    // INCR and EXPIRE in one round trip; also heals a counter that lost its TTL
    static final RedisScript<Long> INCREMENT_WITH_EXPIRY = new DefaultRedisScript<>(
            "local count = redis.call('INCR', KEYS[1])\n"
                    + "if count == 1 or redis.call('TTL', KEYS[1]) == -1 then\n"
                    + "  redis.call('EXPIRE', KEYS[1], ARGV[1])\n"
                    + "end\n"
                    + "return count",
            Long.class);

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return translate("GET", () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        translate("SETEX", () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        Long value = translate("INCR", () -> redis.execute(
                INCREMENT_WITH_EXPIRY, List.of(key), Long.toString(ttl.toSeconds())));
        if (value == null) {
            throw new StoreUnavailableException("INCR returned no value for " + key, null);
        }
        return value;
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(translate("DEL", () -> redis.delete(key)));
    }

    @Override
    public List<String> scanKeys(String pattern) {
        return translate("SCAN", () -> {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
            try (Cursor<String> cursor = redis.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public boolean ping() {
        String pong = translate("PING", () -> redis.execute((RedisCallback<String>) RedisConnection::ping));
        return "PONG".equalsIgnoreCase(pong);
    }

    private <T> T translate(String command, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + command + " failed: " + e.getMessage(), e);
        }
    }
}
