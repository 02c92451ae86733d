package com.missingtable.sync.messaging;

import com.missingtable.sync.dto.IngestionOutcome;
import com.missingtable.sync.service.RetryingIngestionExecutor;
import com.rabbitmq.client.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Component
@ConditionalOnProperty(prefix = "sync.ingest.rmq", name = "enabled", havingValue = "true")
public class MatchQueueListener {

    private static final Logger log = LoggerFactory.getLogger(MatchQueueListener.class);

    private final RetryingIngestionExecutor executor;

    public MatchQueueListener(RetryingIngestionExecutor executor) {
        this.executor = executor;
    }

    /**
     * Acks once the message is either reconciled or dead-lettered. If neither could be
     * stored the message goes back on the queue.
     */
    @RabbitListener(queues = "${sync.ingest.rmq.queue:match_processing}",
            containerFactory = "matchListenerContainerFactory", ackMode = "MANUAL")
    public void handle(Message message, Channel channel) throws IOException {
        long tag = message.getMessageProperties().getDeliveryTag();
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        IngestionOutcome outcome;
        try {
            outcome = executor.execute(raw);
        } catch (RuntimeException ex) {
            log.error("[Ingest][RMQ] message {} not recorded anywhere, requeueing", tag, ex);
            channel.basicNack(tag, false, true);
            return;
        }
        channel.basicAck(tag, false);
        if (outcome.isDeadLettered()) {
            log.warn("[Ingest][RMQ] message {} dead-lettered as {}", tag, outcome.deadLetterId());
        } else {
            log.debug("[Ingest][RMQ] message {} -> {} match {}", tag, outcome.action(), outcome.matchId());
        }
    }
}
