package com.example.gateway.messaging;

public class BrokerUnreachableException extends RuntimeException {

    public BrokerUnreachableException(String host, int port, int attempts) {
        super("RabbitMQ TCP port " + host + ":" + port + " not reachable after " + attempts + " attempts");
    }

    public BrokerUnreachableException(String host, int port, String reason) {
        super("RabbitMQ at " + host + ":" + port + " not reachable: " + reason);
    }
}
