package io.riskradar.ingestion.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic incidentEvaluatedTopic(KafkaProperties topics) {
        return TopicBuilder.name(topics.incidentEvaluated()).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic threatConfirmedTopic(KafkaProperties topics) {
        return TopicBuilder.name(topics.threatConfirmed()).partitions(3).replicas(1).build();
    }

    @Bean
    public NewTopic batchProcessedTopic(KafkaProperties topics) {
        return TopicBuilder.name(topics.batchProcessed()).partitions(1).replicas(1).build();
    }
}
