package com.example.gateway.messaging;

import com.example.gateway.config.BrokerProperties;
import com.example.gateway.model.NotificationJob;
import com.rabbitmq.client.ShutdownSignalException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionListener;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Publishes jobs to the direct exchange over one shared connection. The connection is established
 * lazily (probe, connect, declare) and re-established the same way after it drops, so callers only
 * ever see the outcome of the publish itself. Each publish waits for the broker confirm.
 *
 * <p>A reconnect triggered by a publish gets a single readiness attempt instead of the startup budget.
 * Threads that queued behind a connect attempt which then failed give up without retrying it.
 */
@Slf4j
@Component
public class RabbitNotificationPublisher implements NotificationPublisher {

    static final String HEADER_CORRELATION_ID = "correlation_id";
    static final String HEADER_NOTIFICATION_ID = "notification_id";
    private static final long CONFIRM_TIMEOUT_MS = 5000;
    static final int ON_REQUEST_READINESS_ATTEMPTS = 1;

    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final CachingConnectionFactory connectionFactory;
    private final BrokerReadinessProbe probe;
    private final BrokerProperties broker;
    private final ReentrantLock connectLock = new ReentrantLock();
    private final AtomicLong failedConnects = new AtomicLong();

    private volatile boolean ready;

    public RabbitNotificationPublisher(
            RabbitTemplate rabbitTemplate,
            AmqpAdmin amqpAdmin,
            CachingConnectionFactory connectionFactory,
            BrokerReadinessProbe probe,
            BrokerProperties properties
    ) {
        this.rabbitTemplate = rabbitTemplate;
        this.amqpAdmin = amqpAdmin;
        this.connectionFactory = connectionFactory;
        this.probe = probe;
        this.broker = properties.resolve();
        this.connectionFactory.addConnectionListener(new ConnectionListener() {
            @Override
            public void onCreate(Connection connection) {
                log.debug("event=broker_connection_created");
            }

            @Override
            public void onClose(Connection connection) {
                markLost("closed");
            }

            @Override
            public void onShutDown(ShutdownSignalException signal) {
                markLost(signal.getMessage());
            }
        });
    }

    @Override
    public void connect() {
        connect(() -> probe.awaitReachable(broker.host(), broker.port()));
    }

    private void connect(Runnable readinessCheck) {
        long failuresSeen = failedConnects.get();
        connectLock.lock();
        try {
            if (ready) {
                return;
            }
            if (failedConnects.get() != failuresSeen) {
                throw new BrokerUnreachableException(broker.host(), broker.port(),
                        "connect attempt failed while waiting");
            }
            try {
                readinessCheck.run();
                amqpAdmin.initialize();
            } catch (RuntimeException e) {
                failedConnects.incrementAndGet();
                throw e;
            }
            ready = true;
            log.info("event=broker_connected host={} port={} vhost={} exchange={} tls={}",
                    broker.host(), broker.port(), broker.virtualHost(), broker.exchange(), broker.tls());
        } finally {
            connectLock.unlock();
        }
    }

    @Override
    public void publish(String routingKey, NotificationJob job) {
        try {
            if (!ready) {
                connect(() -> probe.awaitReachable(broker.host(), broker.port(), ON_REQUEST_READINESS_ATTEMPTS));
            }
            rabbitTemplate.invoke(operations -> {
                operations.convertAndSend(broker.exchange(), routingKey, job, message -> {
                    MessageProperties props = message.getMessageProperties();
                    props.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
                    props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
                    props.setMessageId(job.notificationId());
                    props.setCorrelationId(job.correlationId());
                    props.setHeader(HEADER_CORRELATION_ID, job.correlationId());
                    props.setHeader(HEADER_NOTIFICATION_ID, job.notificationId());
                    return message;
                });
                operations.waitForConfirmsOrDie(CONFIRM_TIMEOUT_MS);
                return null;
            });
        } catch (AmqpException | BrokerUnreachableException e) {
            log.error("event=notify_publish_failed notificationId={} routingKey={} error={}",
                    job.notificationId(), routingKey, e.getMessage());
            throw new PublishFailureException(job.notificationId(), e);
        }
        log.info("event=notify_published notificationId={} routingKey={}", job.notificationId(), routingKey);
    }

    @Override
    public boolean isConnected() {
        return ready;
    }

    @PreDestroy
    public void disconnect() {
        ready = false;
        connectionFactory.resetConnection();
        log.info("event=broker_disconnected");
    }

    private void markLost(String reason) {
        if (ready) {
            log.warn("event=broker_connection_lost reason={}", reason);
        }
        ready = false;
    }
}
