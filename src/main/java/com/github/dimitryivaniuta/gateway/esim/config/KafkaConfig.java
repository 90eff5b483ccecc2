package com.github.dimitryivaniuta.gateway.esim.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Kafka topic and consumer error handling configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Delivery events topic, for environments where topics are not provisioned by IaC.
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic deliveryEventsTopic(AppProperties props) {
        return TopicBuilder.name(props.getOutbox().getDeliveryEventsTopic())
                .partitions(6)
                .replicas(1)
                .build();
    }

    /**
     * Redelivers a failed delivery event with exponential backoff; after roughly ten minutes the record
     * is logged and skipped. The delivery stays DELIVERED and the missing email is visible as the absence
     * of a SENT {@code DeliveryAttempt}.
     *
     * @return error handler picked up by the Boot listener container factory
     */
    @Bean
    public CommonErrorHandler deliveryEventErrorHandler() {
        ExponentialBackOff backOff = new ExponentialBackOff(2_000L, 2.0);
        backOff.setMaxInterval(120_000L);
        backOff.setMaxElapsedTime(600_000L);
        return new DefaultErrorHandler(backOff);
    }
}
