package com.example.gateway.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * RabbitMQ connection settings. A non-blank {@code url} ({@code amqp[s]://user:pass@host:port/vhost})
 * overrides the discrete fields; see {@link #resolve()}.
 */
@Slf4j
@ConfigurationProperties(prefix = "gateway.broker")
public record BrokerProperties(
        @DefaultValue("localhost") String host,
        @DefaultValue("5672") int port,
        @DefaultValue("guest") String username,
        @DefaultValue("guest") String password,
        @DefaultValue("/") String virtualHost,
        @DefaultValue("notifications.direct") String exchange,
        String url,
        @DefaultValue("5671") int tlsPort,
        @DefaultValue("10") int connectionTimeoutSec,
        @DefaultValue Probe probe
) {

    public record Probe(
            @DefaultValue("10") int maxRetries,
            @DefaultValue("1000") long baseDelayMs,
            @DefaultValue("3000") int attemptTimeoutMs
    ) {}

    public boolean tls() {
        return port == tlsPort;
    }

    public BrokerProperties resolve() {
        if (url == null || url.isBlank()) {
            return this;
        }
        try {
            URI uri = URI.create(url.trim());
            String resolvedHost = uri.getHost() != null ? uri.getHost() : host;
            int resolvedPort = uri.getPort() > 0 ? uri.getPort() : port;
            String resolvedUser = username;
            String resolvedPass = password;
            String userInfo = uri.getRawUserInfo();
            if (userInfo != null) {
                int colon = userInfo.indexOf(':');
                resolvedUser = decode(colon >= 0 ? userInfo.substring(0, colon) : userInfo);
                if (colon >= 0) {
                    resolvedPass = decode(userInfo.substring(colon + 1));
                }
            }
            String resolvedVhost = virtualHost;
            String path = uri.getRawPath();
            if (path != null && path.length() > 1) {
                resolvedVhost = decode(path.substring(1));
            }
            return new BrokerProperties(resolvedHost, resolvedPort, resolvedUser, resolvedPass,
                    resolvedVhost, exchange, null, tlsPort, connectionTimeoutSec, probe);
        } catch (IllegalArgumentException e) {
            log.warn("event=broker_url_ignored reason={}", e.getMessage());
            return this;
        }
    }

    private static String decode(String raw) {
        return URLDecoder.decode(raw, StandardCharsets.UTF_8);
    }
}
