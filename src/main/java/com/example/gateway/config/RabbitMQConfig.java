package com.example.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;

/**
 * Broker connection and topology. Every exchange and queue is durable; RabbitAdmin redeclares them
 * on each new connection, which is safe because the declarations are identical.
 */
@Slf4j
@Configuration
public class RabbitMQConfig {

    public static final String DEAD_LETTER_EXCHANGE = "notifications.dlx";

    public static final String EMAIL_QUEUE = "email.queue";
    public static final String PUSH_QUEUE = "push.queue";
    public static final String FAILED_QUEUE = "failed.queue";

    public static final String EMAIL_KEY = "notification.email";
    public static final String PUSH_KEY = "notification.push";

    @Bean
    CachingConnectionFactory rabbitConnectionFactory(BrokerProperties properties) throws GeneralSecurityException {
        BrokerProperties broker = properties.resolve();

        com.rabbitmq.client.ConnectionFactory rabbit = new com.rabbitmq.client.ConnectionFactory();
        rabbit.setHost(broker.host());
        rabbit.setPort(broker.port());
        rabbit.setUsername(broker.username());
        rabbit.setPassword(broker.password());
        rabbit.setVirtualHost(broker.virtualHost());
        rabbit.setConnectionTimeout(broker.connectionTimeoutSec() * 1000);
        if (broker.tls()) {
            // certificate and hostname checks are off on the TLS port (self-signed/mismatched chains)
            rabbit.useSslProtocol();
            log.warn("event=broker_tls_unverified host={} port={}", broker.host(), broker.port());
        }

        CachingConnectionFactory factory = new CachingConnectionFactory(rabbit);
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.SIMPLE);
        factory.setConnectionNameStrategy(cf -> "api-gateway");
        return factory;
    }

    @Bean
    MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    // Exchanges
    @Bean
    DirectExchange notificationExchange(BrokerProperties properties) {
        return new DirectExchange(properties.exchange(), true, false);
    }

    @Bean
    FanoutExchange deadLetterExchange() {
        return new FanoutExchange(DEAD_LETTER_EXCHANGE, true, false);
    }

    // Queues
    @Bean
    Queue failedQueue() {
        return QueueBuilder.durable(FAILED_QUEUE).build();
    }

    @Bean
    Queue emailQueue() {
        return QueueBuilder.durable(EMAIL_QUEUE)
                .deadLetterExchange(DEAD_LETTER_EXCHANGE)
                .build();
    }

    @Bean
    Queue pushQueue() {
        return QueueBuilder.durable(PUSH_QUEUE)
                .deadLetterExchange(DEAD_LETTER_EXCHANGE)
                .build();
    }

    // Bindings
    @Bean
    Binding failedBinding(Queue failedQueue, FanoutExchange deadLetterExchange) {
        return BindingBuilder.bind(failedQueue).to(deadLetterExchange);
    }

    @Bean
    Binding emailBinding(Queue emailQueue, DirectExchange notificationExchange) {
        return BindingBuilder.bind(emailQueue).to(notificationExchange).with(EMAIL_KEY);
    }

    @Bean
    Binding pushBinding(Queue pushQueue, DirectExchange notificationExchange) {
        return BindingBuilder.bind(pushQueue).to(notificationExchange).with(PUSH_KEY);
    }
}
