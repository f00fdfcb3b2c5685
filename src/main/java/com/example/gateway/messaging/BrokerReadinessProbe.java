package com.example.gateway.messaging;

import com.example.gateway.config.BrokerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Plain TCP check run before the AMQP handshake. The broker can accept connections on its port
 * before the protocol layer is ready, which otherwise surfaces as confusing handshake errors.
 * Waits {@code baseDelay * 2^(attempt-1)} between attempts.
 */
@Slf4j
@Component
public class BrokerReadinessProbe {

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxRetries;
    private final long baseDelayMs;
    private final int attemptTimeoutMs;
    private final Sleeper sleeper;

    @Autowired
    public BrokerReadinessProbe(BrokerProperties properties) {
        this(properties.probe().maxRetries(), properties.probe().baseDelayMs(),
                properties.probe().attemptTimeoutMs(), Thread::sleep);
    }

    BrokerReadinessProbe(int maxRetries, long baseDelayMs, int attemptTimeoutMs, Sleeper sleeper) {
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.attemptTimeoutMs = attemptTimeoutMs;
        this.sleeper = sleeper;
    }

    /** Full startup budget of {@code maxRetries} attempts. */
    public void awaitReachable(String host, int port) {
        awaitReachable(host, port, maxRetries);
    }

    public void awaitReachable(String host, int port, int maxRetries) {
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try (Socket socket = new Socket()) {
                socket.connect(new InetSocketAddress(host, port), attemptTimeoutMs);
                log.info("event=broker_port_open host={} port={} attempt={}", host, port, attempt);
                return;
            } catch (IOException e) {
                log.debug("event=broker_not_ready host={} port={} attempt={}/{} error={}",
                        host, port, attempt, maxRetries, e.getMessage());
            }
            if (attempt < maxRetries) {
                backoff(attempt, host, port);
            }
        }
        throw new BrokerUnreachableException(host, port, maxRetries);
    }

    long delayFor(int attempt) {
        return baseDelayMs * (1L << (attempt - 1));
    }

    private void backoff(int attempt, String host, int port) {
        try {
            sleeper.sleep(delayFor(attempt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerUnreachableException(host, port, attempt);
        }
    }
}
