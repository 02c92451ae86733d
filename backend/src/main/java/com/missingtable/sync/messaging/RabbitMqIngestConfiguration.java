package com.missingtable.sync.messaging;

import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue topology and worker pool for queue-driven ingestion. Each consumer thread handles
 * one message at a time and acknowledges it only after its outcome is durable.
 */
@Configuration
@EnableRabbit
@ConditionalOnProperty(prefix = "sync.ingest.rmq", name = "enabled", havingValue = "true")
public class RabbitMqIngestConfiguration {

    @Value("${sync.ingest.rmq.queue:match_processing}")
    private String queueName;

    @Value("${sync.ingest.rmq.exchange:match_processing}")
    private String exchangeName;

    @Value("${sync.ingest.rmq.routing-pattern:match.*}")
    private String routingPattern;

    @Bean
    public Queue matchProcessingQueue() {
        return new Queue(queueName, true);
    }

    @Bean
    public TopicExchange matchProcessingExchange() {
        return new TopicExchange(exchangeName, true, false);
    }

    @Bean
    public Binding matchProcessingBinding(Queue matchProcessingQueue, TopicExchange matchProcessingExchange) {
        return BindingBuilder.bind(matchProcessingQueue).to(matchProcessingExchange).with(routingPattern);
    }

    @Bean(name = "matchListenerContainerFactory")
    public SimpleRabbitListenerContainerFactory matchListenerContainerFactory(
            ConnectionFactory connectionFactory,
            @Value("${sync.ingest.rmq.concurrency:4}") int concurrency,
            @Value("${sync.ingest.rmq.max-concurrency:8}") int maxConcurrency) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setConcurrentConsumers(concurrency);
        factory.setMaxConcurrentConsumers(Math.max(concurrency, maxConcurrency));
        // late ack: a message in flight on a crashed worker is redelivered
        factory.setPrefetchCount(1);
        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        return factory;
    }
}
