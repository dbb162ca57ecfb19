package com.flagship.mobile_payments.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.payment-status:payment-status}")
    private String paymentStatusTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    /**
     * Status events are keyed by checkout id, so ordering holds per transaction
     * across any number of partitions.
     */
    @Bean
    public NewTopic paymentStatusTopic() {
        return TopicBuilder.name(paymentStatusTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
