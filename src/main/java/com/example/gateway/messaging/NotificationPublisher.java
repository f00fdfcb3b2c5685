package com.example.gateway.messaging;

import com.example.gateway.model.NotificationJob;

public interface NotificationPublisher {

    /**
     * Probes the broker, opens the connection and declares the topology.
     *
     * @throws BrokerUnreachableException when the probe budget is exhausted
     */
    void connect();

    /**
     * Publishes {@code job} as a persistent message, reconnecting first if needed.
     *
     * @throws PublishFailureException when the broker did not accept the message
     */
    void publish(String routingKey, NotificationJob job);

    boolean isConnected();
}
