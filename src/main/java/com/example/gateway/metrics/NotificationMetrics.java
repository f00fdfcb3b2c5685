package com.example.gateway.metrics;

import com.example.gateway.circuit.CircuitBreaker;
import com.example.gateway.circuit.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class NotificationMetrics {

    private static final String METRIC_ACCEPTED = "notify_accepted_total";
    private static final String METRIC_REPLAYED = "notify_idempotent_replay_total";
    private static final String METRIC_RATE_LIMITED = "notify_rate_limited_total";
    private static final String METRIC_PUBLISH_FAILED = "notify_publish_failed_total";
    private static final String METRIC_CIRCUIT_REJECTED = "notify_circuit_rejected_total";
    private static final String METRIC_STATUS_UPDATE = "notify_status_update_total";
    private static final String METRIC_CIRCUIT_STATE = "notify_circuit_state";
    private static final String METRIC_LATENCY = "notify_accept_seconds";

    private final MeterRegistry registry;

    private final Counter acceptedCounter;
    private final Counter replayedCounter;
    private final Counter rateLimitedCounter;
    private final Counter publishFailedCounter;
    private final Counter circuitRejectedCounter;
    private final Timer acceptTimer;

    public NotificationMetrics(MeterRegistry registry, CircuitBreaker brokerCircuitBreaker) {
        this.registry = registry;

        this.acceptedCounter = createCounter(METRIC_ACCEPTED, "Notifications queued and recorded as pending");
        this.replayedCounter = createCounter(METRIC_REPLAYED, "Requests answered from the idempotency cache");
        this.rateLimitedCounter = createCounter(METRIC_RATE_LIMITED, "Requests rejected by the rate limiter");
        this.publishFailedCounter = createCounter(METRIC_PUBLISH_FAILED, "Publish attempts that failed at the broker");
        this.circuitRejectedCounter = createCounter(METRIC_CIRCUIT_REJECTED, "Publishes rejected by an open circuit");

        this.acceptTimer = Timer.builder(METRIC_LATENCY).register(registry);

        registerCircuitGauge(brokerCircuitBreaker);
    }

    private Counter createCounter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    // 0 = closed, 1 = half_open, 2 = open
    private void registerCircuitGauge(CircuitBreaker circuitBreaker) {
        Gauge.builder(METRIC_CIRCUIT_STATE, circuitBreaker, cb -> {
                    CircuitState state = cb.state();
                    return switch (state) {
                        case CLOSED -> 0.0;
                        case HALF_OPEN -> 1.0;
                        case OPEN -> 2.0;
                    };
                })
                .tag("circuit", circuitBreaker.name())
                .description("Current circuit breaker state")
                .register(registry);
    }

    public void recordAccepted() { acceptedCounter.increment(); }

    public void recordReplay() { replayedCounter.increment(); }

    public void recordRateLimited() { rateLimitedCounter.increment(); }

    public void recordPublishFailed() { publishFailedCounter.increment(); }

    public void recordCircuitRejected() { circuitRejectedCounter.increment(); }

    public void recordStatusUpdate(String status) {
        Counter.builder(METRIC_STATUS_UPDATE)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordAcceptDurationNs(long durationNs) {
        acceptTimer.record(durationNs, TimeUnit.NANOSECONDS);
    }
}
