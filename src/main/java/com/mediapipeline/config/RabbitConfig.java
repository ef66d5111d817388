package com.mediapipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue topology:
 * <pre>
 *   media.events --video.uploaded--> transcode.jobs
 *   transcode.jobs.retry (per-message TTL) --dead-letter--> transcode.jobs
 *   transcode.jobs.dlq                        terminal
 *   media.events --video.deleted--> playback.purge
 *   media.events --video.transcoded--> (catalog)
 * </pre>
 */
@Configuration
public class RabbitConfig {

    @Value("${media.queue.exchange:media.events}")
    private String exchange;

    @Value("${media.queue.upload:transcode.jobs}")
    private String uploadQueue;

    @Value("${media.queue.upload-routing-key:video.uploaded}")
    private String uploadRoutingKey;

    @Value("${media.queue.retry:transcode.jobs.retry}")
    private String retryQueue;

    @Value("${media.queue.dead-letter:transcode.jobs.dlq}")
    private String deadLetterQueue;

    @Value("${media.queue.purge:playback.purge}")
    private String purgeQueue;

    @Value("${media.queue.purge-routing-key:video.deleted}")
    private String purgeRoutingKey;

    @Bean
    public Declarables mediaTopology() {
        TopicExchange events = new TopicExchange(exchange, true, false);

        Queue jobs = QueueBuilder.durable(uploadQueue).build();
        Queue retry = QueueBuilder.durable(retryQueue)
                .deadLetterExchange("")
                .deadLetterRoutingKey(uploadQueue)
                .build();
        Queue deadLetters = QueueBuilder.durable(deadLetterQueue).build();
        Queue purge = QueueBuilder.durable(purgeQueue).build();

        Binding jobsBinding = BindingBuilder.bind(jobs).to(events).with(uploadRoutingKey);
        Binding purgeBinding = BindingBuilder.bind(purge).to(events).with(purgeRoutingKey);

        return new Declarables(events, jobs, retry, deadLetters, purge, jobsBinding, purgeBinding);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    /**
     * Fixed-size worker pool for transcode jobs. Prefetch bounds how many unacknowledged
     * jobs each worker holds; a job is acknowledged only after the handler returns.
     */
    @Bean
    public SimpleRabbitListenerContainerFactory transcodeListenerFactory(
            SimpleRabbitListenerContainerFactoryConfigurer configurer,
            ConnectionFactory connectionFactory,
            @Value("${media.transcoder.concurrency:1}") int concurrency,
            @Value("${media.transcoder.prefetch:1}") int prefetch) {
        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        configurer.configure(factory, connectionFactory);
        factory.setConcurrentConsumers(concurrency);
        factory.setMaxConcurrentConsumers(concurrency);
        factory.setPrefetchCount(prefetch);
        factory.setAcknowledgeMode(AcknowledgeMode.AUTO);
        factory.setDefaultRequeueRejected(true);
        return factory;
    }
}
