package com.flagship.billing_eligibility.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the topic SnapshotPublished events are relayed to.
 * Single partition: consumers see snapshots in commit order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.snapshots:eligibility.snapshots}")
    private String snapshotsTopic;

    @Bean
    public NewTopic snapshotsTopic() {
        return TopicBuilder.name(snapshotsTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
