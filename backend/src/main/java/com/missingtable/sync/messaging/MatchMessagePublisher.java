package com.missingtable.sync.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/** Puts match messages on the processing exchange for asynchronous reconciliation. */
@Component
@ConditionalOnProperty(prefix = "sync.ingest.rmq", name = "enabled", havingValue = "true")
public class MatchMessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MatchMessagePublisher.class);

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;
    private final String routingKey;

    public MatchMessagePublisher(RabbitTemplate rabbitTemplate,
                                 @Value("${sync.ingest.rmq.exchange:match_processing}") String exchange,
                                 @Value("${sync.ingest.rmq.routing-key:match.process}") String routingKey) {
        this.rabbitTemplate = rabbitTemplate;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public void publish(JsonNode payload) {
        Message message = MessageBuilder.withBody(payload.toString().getBytes(StandardCharsets.UTF_8))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setContentEncoding(StandardCharsets.UTF_8.name())
                .setDeliveryMode(MessageDeliveryMode.PERSISTENT)
                .build();
        rabbitTemplate.send(exchange, routingKey, message);
        log.debug("[Ingest][RMQ] published to {}/{}", exchange, routingKey);
    }
}
