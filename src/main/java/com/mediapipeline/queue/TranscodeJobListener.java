package com.mediapipeline.queue;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Pulls upload events off the job queue. The delivery is acknowledged when this method
 * returns, so a crash mid-job leaves it on the broker for redelivery. Retries and
 * dead letters are republished before the ack.
 */
@Component
@ConditionalOnProperty(name = "media.transcoder.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class TranscodeJobListener {

    static final String ATTEMPT_HEADER = "x-attempt";
    static final String FAILURE_REASON_HEADER = "x-failure-reason";

    private final JobMessageHandler handler;
    private final RabbitTemplate rabbitTemplate;
    private final String retryQueue;
    private final String deadLetterQueue;

    public TranscodeJobListener(JobMessageHandler handler,
                                RabbitTemplate rabbitTemplate,
                                @Value("${media.queue.retry:transcode.jobs.retry}") String retryQueue,
                                @Value("${media.queue.dead-letter:transcode.jobs.dlq}") String deadLetterQueue) {
        this.handler = handler;
        this.rabbitTemplate = rabbitTemplate;
        this.retryQueue = retryQueue;
        this.deadLetterQueue = deadLetterQueue;
    }

    @RabbitListener(queues = "${media.queue.upload:transcode.jobs}", containerFactory = "transcodeListenerFactory")
    public void onUploadEvent(Message message) {
        int attempt = attemptOf(message);
        log.info("Received upload event (attempt {}, redelivered: {})",
                attempt, message.getMessageProperties().isRedelivered());

        JobOutcome outcome = handler.handle(message.getBody(), attempt);

        switch (outcome.getState()) {
            case RETRYING:
                Message retry = MessageBuilder.fromMessage(message)
                        .setHeader(ATTEMPT_HEADER, attempt + 1)
                        .setHeader(FAILURE_REASON_HEADER, outcome.getReason())
                        .setExpiration(String.valueOf(outcome.getRetryDelay().toMillis()))
                        .build();
                rabbitTemplate.send("", retryQueue, retry);
                log.info("Requeued job for attempt {} after {} ms", attempt + 1, outcome.getRetryDelay().toMillis());
                break;
            case DEAD_LETTERED:
                Message dead = MessageBuilder.fromMessage(message)
                        .setHeader(ATTEMPT_HEADER, attempt)
                        .setHeader(FAILURE_REASON_HEADER, outcome.getReason())
                        .build();
                rabbitTemplate.send("", deadLetterQueue, dead);
                log.warn("Dead-lettered job after attempt {}: {}", attempt, outcome.getReason());
                break;
            default:
                break;
        }
    }

    static int attemptOf(Message message) {
        Object header = message.getMessageProperties().getHeader(ATTEMPT_HEADER);
        if (header instanceof Number) {
            return Math.max(1, ((Number) header).intValue());
        }
        if (header != null) {
            try {
                return Math.max(1, Integer.parseInt(header.toString()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed {} header: {}", ATTEMPT_HEADER, header);
            }
        }
        return 1;
    }
}
