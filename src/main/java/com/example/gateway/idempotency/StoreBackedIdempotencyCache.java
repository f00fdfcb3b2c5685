package com.example.gateway.idempotency;

import com.example.gateway.api.ApiResponse;
import com.example.gateway.api.response.NotificationAccepted;
import com.example.gateway.config.IdempotencyProperties;
import com.example.gateway.store.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

@Slf4j
@Component
public class StoreBackedIdempotencyCache implements IdempotencyCache {

    private static final TypeReference<ApiResponse<NotificationAccepted>> RESPONSE_TYPE = new TypeReference<>() {};

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public StoreBackedIdempotencyCache(
            KeyValueStore store,
            ObjectMapper objectMapper,
            IdempotencyProperties properties
    ) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(properties.ttlSec());
    }

    private String k(String requestId) {
        return "idempotent:" + requestId;
    }

    @Override
    public Optional<ApiResponse<NotificationAccepted>> lookup(String requestId) {
        Optional<String> cached = store.get(k(requestId));
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(cached.get(), RESPONSE_TYPE));
        } catch (JsonProcessingException e) {
            // unreadable entry behaves like a miss; the next store() overwrites it
            log.warn("event=idempotency_entry_unreadable requestId={} error={}", requestId, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void store(String requestId, ApiResponse<NotificationAccepted> response) {
        String json;
        try {
            json = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize response for request " + requestId, e);
        }
        store.set(k(requestId), json, ttl);
    }
}
