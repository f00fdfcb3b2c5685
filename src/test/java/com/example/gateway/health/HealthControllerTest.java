package com.example.gateway.health;

import com.example.gateway.circuit.CircuitBreaker;
import com.example.gateway.messaging.NotificationPublisher;
import com.example.gateway.store.KeyValueStore;
import com.example.gateway.store.StoreUnavailableException;
import com.example.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private StartupState startupState;
    private NotificationPublisher publisher;
    private KeyValueStore keyValueStore;
    private CircuitBreaker breaker;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        startupState = new StartupState();
        publisher = mock(NotificationPublisher.class);
        keyValueStore = mock(KeyValueStore.class);
        breaker = new CircuitBreaker("rabbitmq", 1, Duration.ofSeconds(60), clock);
        controller = new HealthController(startupState, publisher, breaker, keyValueStore, clock, "api-gateway", "1.0.0");
    }

    @Test
    void reportsStartingUntilInitializationFinishes() {
        HealthResponse response = controller.health();

        assertThat(response.status()).isEqualTo("starting");
        assertThat(response.message()).isEqualTo("Service initializing...");
        assertThat(response.checks()).isNull();
    }

    @Test
    void healthyWhenBothDependenciesAreUp() {
        startupState.markComplete();
        when(publisher.isConnected()).thenReturn(true);
        when(keyValueStore.ping()).thenReturn(true);

        HealthResponse response = controller.health();

        assertThat(response.status()).isEqualTo("healthy");
        assertThat(response.service()).isEqualTo("api-gateway");
        assertThat(response.timestamp()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(response.checks())
                .containsEntry("rabbitmq", true)
                .containsEntry("redis", true)
                .containsEntry("service", "up");
    }

    @Test
    void degradedWhenRedisIsDown() {
        startupState.markComplete();
        when(publisher.isConnected()).thenReturn(true);
        when(keyValueStore.ping()).thenThrow(new StoreUnavailableException("Redis PING failed", null));

        HealthResponse response = controller.health();

        assertThat(response.status()).isEqualTo("degraded");
        assertThat(response.checks()).containsEntry("redis", false).containsEntry("rabbitmq", true);
    }

    @Test
    void openCircuitCountsAsBrokerDown() {
        startupState.markComplete();
        when(publisher.isConnected()).thenReturn(true);
        when(keyValueStore.ping()).thenReturn(true);
        try {
            breaker.run(() -> {
                throw new IllegalStateException("down");
            });
        } catch (IllegalStateException expected) {
            // one failure opens a breaker with failMax 1
        }

        HealthResponse response = controller.health();

        assertThat(response.status()).isEqualTo("degraded");
        assertThat(response.checks()).containsEntry("rabbitmq", false);
    }

    @Test
    void rootDescribesService() {
        assertThat(controller.root())
                .containsEntry("service", "API Gateway")
                .containsEntry("status", "running")
                .containsEntry("health_check", "/health");
    }
}
