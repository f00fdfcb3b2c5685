package com.example.gateway.health;

import com.example.gateway.messaging.NotificationPublisher;
import com.example.gateway.store.KeyValueStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Connects to RabbitMQ and Redis once the HTTP server is up. Runs off the main thread so that
 * {@code /health} answers "starting" meanwhile. A failure leaves the service running degraded;
 * publishes reconnect on demand and {@code /health} reports what is down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayStartupRunner {

    private final NotificationPublisher publisher;
    private final KeyValueStore keyValueStore;
    private final StartupState startupState;
    private final SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("gateway-startup-");

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        executor.execute(this::initialize);
    }

    void initialize() {
        log.info("event=startup_begin");
        try {
            publisher.connect();
            if (!keyValueStore.ping()) {
                throw new IllegalStateException("Redis PING did not return PONG");
            }
            log.info("event=startup_complete degraded=false");
        } catch (RuntimeException e) {
            log.error("event=startup_complete degraded=true error={}", e.getMessage());
        } finally {
            startupState.markComplete();
        }
    }
}
