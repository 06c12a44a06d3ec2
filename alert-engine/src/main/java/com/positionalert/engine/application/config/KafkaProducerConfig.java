package com.positionalert.engine.application.config;

import com.positionalert.common.event.AlertEvent;
import java.util.HashMap;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.kafka.autoconfigure.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JacksonJsonSerializer;

@Configuration
@ConditionalOnProperty(name = "alert.dispatch.mode", havingValue = "kafka", matchIfMissing = true)
public class KafkaProducerConfig {

    @Bean
    public ProducerFactory<String, AlertEvent> alertEventProducerFactory(KafkaProperties kafkaProperties) {
        var props = new HashMap<String, Object>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.getBootstrapServers());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "alert-engine");
        return new DefaultKafkaProducerFactory<>(
                props, new StringSerializer(), new JacksonJsonSerializer<AlertEvent>());
    }

    @Bean
    public KafkaTemplate<String, AlertEvent> alertEventKafkaTemplate(
            ProducerFactory<String, AlertEvent> alertEventProducerFactory) {
        return new KafkaTemplate<>(alertEventProducerFactory);
    }
}
