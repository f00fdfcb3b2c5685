package com.example.gateway.config;

import com.example.gateway.circuit.CircuitBreaker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /** Guards publishes to RabbitMQ. One instance per process, shared by all request threads. */
    @Bean
    CircuitBreaker brokerCircuitBreaker(CircuitBreakerProperties properties, Clock clock) {
        return new CircuitBreaker(
                "rabbitmq",
                properties.failMax(),
                Duration.ofSeconds(properties.timeoutSec()),
                clock);
    }
}
