package com.mediapipeline.queue;

import com.mediapipeline.model.CompletionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CompletionEventPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final String exchange;
    private final String routingKey;

    public CompletionEventPublisher(
            RabbitTemplate rabbitTemplate,
            @Value("${media.queue.exchange:media.events}") String exchange,
            @Value("${media.queue.completion-routing-key:video.transcoded}") String routingKey) {
        this.rabbitTemplate = rabbitTemplate;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    /**
     * Throws {@link org.springframework.amqp.AmqpException} when the broker is unavailable;
     * the caller treats that as a failed job.
     */
    public void publish(CompletionEvent event) {
        rabbitTemplate.convertAndSend(exchange, routingKey, event);
        log.info("Published completion event for upload {} ({} -> {})", event.getUploadId(), exchange, routingKey);
    }
}
