package com.example.gateway.circuit;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Failure-isolation guard around one unreliable downstream call, backed by a resilience4j breaker.
 *
 * <ul>
 *   <li>CLOSED: calls pass; {@code failMax} consecutive failures open the circuit.</li>
 *   <li>OPEN: calls are rejected with {@link CircuitOpenException} until {@code timeout} has elapsed;
 *       the next attempt after that becomes the half-open probe.</li>
 *   <li>HALF_OPEN: only the probe runs. Success closes the circuit, failure reopens it at once.
 *       Concurrent callers are rejected while the probe is in flight.</li>
 * </ul>
 *
 * A count-based window of {@code failMax} calls with a 100% failure threshold opens exactly when the
 * last {@code failMax} calls all failed. State lives in memory only and starts CLOSED.
 */
@Slf4j
public class CircuitBreaker {

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private final int failMax;
    private final Clock clock;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureTime = new AtomicReference<>();

    public CircuitBreaker(String name, int failMax, Duration timeout, Clock clock) {
        if (failMax < 1) {
            throw new IllegalArgumentException("failMax must be >= 1");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.failMax = failMax;
        this.clock = clock;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failMax)
                .minimumNumberOfCalls(failMax)
                .failureRateThreshold(100)
                .waitDurationInOpenState(timeout)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .clock(clock)
                .build();
        this.delegate = io.github.resilience4j.circuitbreaker.CircuitBreaker.of(name, config);

        delegate.getEventPublisher()
                .onStateTransition(event -> log.warn("event=circuit_state_change circuit={} transition={}",
                        name, event.getStateTransition()))
                .onCallNotPermitted(event -> log.warn("event=circuit_rejected circuit={} state={}",
                        name, state().value()));
    }

    /**
     * Runs {@code operation} if the circuit permits. Failures are recorded and rethrown unchanged.
     *
     * @throws CircuitOpenException when the call is rejected without being attempted
     */
    public <T> T call(Supplier<T> operation) {
        try {
            delegate.acquirePermission();
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(name());
        }

        long start = System.nanoTime();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException | Error e) {
            int failures = consecutiveFailures.incrementAndGet();
            lastFailureTime.set(clock.instant());
            delegate.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
            if (state() == CircuitState.OPEN) {
                log.error("event=circuit_open circuit={} failureCount={} error={}", name(), failures, e.toString());
            } else {
                log.warn("event=circuit_failure circuit={} failureCount={}/{} error={}",
                        name(), failures, failMax, e.toString());
            }
            throw e;
        }
        consecutiveFailures.set(0);
        delegate.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        return result;
    }

    public void run(Runnable operation) {
        call(() -> {
            operation.run();
            return null;
        });
    }

    public CircuitState state() {
        return switch (delegate.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    public CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(state().value(), consecutiveFailures.get(), lastFailureTime.get());
    }

    public void reset() {
        delegate.reset();
        consecutiveFailures.set(0);
        lastFailureTime.set(null);
        log.info("event=circuit_reset circuit={}", name());
    }

    public String name() {
        return delegate.getName();
    }
}
