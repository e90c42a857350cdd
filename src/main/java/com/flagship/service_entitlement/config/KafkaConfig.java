package com.flagship.service_entitlement.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics published from the outbox. The inbound bookings topic belongs to the
 * booking service and is not declared here.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.contracts:contract-events}")
    private String contractsTopic;

    @Value("${kafka.topic.entitlements:entitlement-events}")
    private String entitlementsTopic;

    @Value("${kafka.topic.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic contractsTopic() {
        return TopicBuilder.name(contractsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic entitlementsTopic() {
        return TopicBuilder.name(entitlementsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
