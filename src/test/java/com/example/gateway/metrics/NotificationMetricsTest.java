package com.example.gateway.metrics;

import com.example.gateway.circuit.CircuitBreaker;
import com.example.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationMetricsTest {

    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private CircuitBreaker breaker;
    private NotificationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        breaker = new CircuitBreaker("rabbitmq", 1, Duration.ofSeconds(10), clock);
        metrics = new NotificationMetrics(registry, breaker);
    }

    @Test
    void countersIncrementIndependently() {
        metrics.recordAccepted();
        metrics.recordAccepted();
        metrics.recordReplay();
        metrics.recordPublishFailed();

        assertThat(registry.counter("notify_accepted_total").count()).isEqualTo(2.0);
        assertThat(registry.counter("notify_idempotent_replay_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("notify_publish_failed_total").count()).isEqualTo(1.0);
        assertThat(registry.counter("notify_rate_limited_total").count()).isZero();
    }

    @Test
    void statusUpdatesAreTaggedByStatus() {
        metrics.recordStatusUpdate("delivered");
        metrics.recordStatusUpdate("delivered");
        metrics.recordStatusUpdate("failed");

        assertThat(registry.counter("notify_status_update_total", "status", "delivered").count()).isEqualTo(2.0);
        assertThat(registry.counter("notify_status_update_total", "status", "failed").count()).isEqualTo(1.0);
    }

    @Test
    void gaugeTracksCircuitState() {
        assertThat(circuitGauge()).isZero();

        try {
            breaker.run(() -> {
                throw new IllegalStateException("down");
            });
        } catch (IllegalStateException expected) {
            // opens the circuit
        }
        assertThat(circuitGauge()).isEqualTo(2.0);

        breaker.reset();
        assertThat(circuitGauge()).isZero();
    }

    @Test
    void acceptLatencyIsTimed() {
        metrics.recordAcceptDurationNs(5_000_000);

        assertThat(registry.timer("notify_accept_seconds").count()).isEqualTo(1);
    }

    private double circuitGauge() {
        return registry.get("notify_circuit_state").tag("circuit", "rabbitmq").gauge().value();
    }
}
