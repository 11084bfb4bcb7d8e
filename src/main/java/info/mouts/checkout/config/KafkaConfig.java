package info.mouts.checkout.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaConfig {
    @Value("${app.kafka.order-status-topic}")
    private String orderStatusTopic;

    @Value("${app.kafka.partitions:3}")
    private int partitions;

    @Value("${app.kafka.replicas:1}")
    private int replicas;

    /**
     * Declares the topic that receives order status changes. Records are keyed
     * by order id, so all changes of one order land on the same partition in
     * commit order.
     *
     * @return The topic definition picked up by the Kafka admin.
     */
    @Bean
    public NewTopic orderStatusTopic() {
        log.info("Declaring Kafka topic {} with {} partitions", orderStatusTopic, partitions);

        return TopicBuilder.name(orderStatusTopic)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }
}
