package com.example.gateway.health;

import com.example.gateway.circuit.CircuitBreaker;
import com.example.gateway.circuit.CircuitState;
import com.example.gateway.messaging.NotificationPublisher;
import com.example.gateway.store.KeyValueStore;
import com.example.gateway.store.StoreUnavailableException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness plus dependency detail. Always answers 200; "degraded" is reported in the body.
 */
@RestController
public class HealthController {

    private final StartupState startupState;
    private final NotificationPublisher publisher;
    private final CircuitBreaker brokerCircuitBreaker;
    private final KeyValueStore keyValueStore;
    private final Clock clock;
    private final String serviceName;
    private final String version;

    public HealthController(
            StartupState startupState,
            NotificationPublisher publisher,
            CircuitBreaker brokerCircuitBreaker,
            KeyValueStore keyValueStore,
            Clock clock,
            @Value("${spring.application.name:api-gateway}") String serviceName,
            @Value("${gateway.version:1.0.0}") String version
    ) {
        this.startupState = startupState;
        this.publisher = publisher;
        this.brokerCircuitBreaker = brokerCircuitBreaker;
        this.keyValueStore = keyValueStore;
        this.clock = clock;
        this.serviceName = serviceName;
        this.version = version;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        String now = Instant.now(clock).toString();
        if (!startupState.isComplete()) {
            return new HealthResponse("starting", serviceName, now, version, null, "Service initializing...");
        }

        boolean rabbit = publisher.isConnected() && brokerCircuitBreaker.state() != CircuitState.OPEN;
        boolean redis = redisUp();

        Map<String, Object> checks = new LinkedHashMap<>();
        checks.put("rabbitmq", rabbit);
        checks.put("redis", redis);
        checks.put("service", "up");

        return new HealthResponse(rabbit && redis ? "healthy" : "degraded", serviceName, now, version, checks, null);
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("service", "API Gateway");
        body.put("version", version);
        body.put("status", "running");
        body.put("health_check", "/health");
        return body;
    }

    private boolean redisUp() {
        try {
            return keyValueStore.ping();
        } catch (StoreUnavailableException e) {
            return false;
        }
    }
}
