package com.example.gateway.store;

import com.example.gateway.config.NotificationStatusProperties;
import com.example.gateway.model.NotificationStatusRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Status records under {@code notification:status:<id>}, stored as JSON with the retention TTL.
 * Store failures propagate: status correctness is load-bearing.
 */
@Slf4j
@Component
public class NotificationStatusStore {

    static final String KEY_PREFIX = "notification:status:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public NotificationStatusStore(
            KeyValueStore store,
            ObjectMapper objectMapper,
            NotificationStatusProperties properties
    ) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(properties.ttlSec());
    }

    public void save(NotificationStatusRecord record) {
        store.set(key(record.notificationId()), write(record), ttl);
    }

    public Optional<NotificationStatusRecord> find(String notificationId) {
        return store.get(key(notificationId)).map(this::read);
    }

    /**
     * Applies {@code change} to an existing record and writes it back with a fresh TTL.
     * Returns empty, writing nothing, when the record does not exist.
     */
    public Optional<NotificationStatusRecord> update(
            String notificationId,
            UnaryOperator<NotificationStatusRecord> change
    ) {
        Optional<NotificationStatusRecord> current = find(notificationId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        NotificationStatusRecord updated = change.apply(current.get());
        save(updated);
        return Optional.of(updated);
    }

    public List<NotificationStatusRecord> findByUser(String userId) {
        List<NotificationStatusRecord> records = new ArrayList<>();
        for (String key : store.scanKeys(KEY_PREFIX + "*")) {
            Optional<String> raw = store.get(key);
            if (raw.isEmpty()) {
                // expired between SCAN and GET
                continue;
            }
            try {
                NotificationStatusRecord record = objectMapper.readValue(raw.get(), NotificationStatusRecord.class);
                if (userId.equals(record.userId())) {
                    records.add(record);
                }
            } catch (JsonProcessingException e) {
                log.warn("event=status_record_unreadable key={} error={}", key, e.getOriginalMessage());
            }
        }
        return records;
    }

    private String key(String notificationId) {
        return KEY_PREFIX + notificationId;
    }

    private String write(NotificationStatusRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize status record " + record.notificationId(), e);
        }
    }

    private NotificationStatusRecord read(String raw) {
        try {
            return objectMapper.readValue(raw, NotificationStatusRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt status record: " + e.getOriginalMessage(), e);
        }
    }
}
