package com.salesops.crmsync.service.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salesops.crmsync.config.CrmSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes lifecycle events to the operator topic. Failed change events are also copied to the
 * dead-letter topic so they can be replayed.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.kafka", name = "enabled", havingValue = "true")
public class KafkaLifecycleEventPublisher implements LifecycleEventHandler {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CrmSyncProperties.Kafka kafka;

    public KafkaLifecycleEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                        ObjectMapper objectMapper,
                                        CrmSyncProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.kafka = properties.getKafka();
    }

    @Override
    public void handle(LifecycleEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize lifecycle event {} {}", event.type(), event.subjectId(), e);
            return;
        }
        String key = event.module() == null ? event.subjectId() : event.module();
        send(kafka.getLifecycleTopic(), key, json);
        if (event.type() == LifecycleEventType.EVENT_FAILED) {
            send(kafka.getDeadLetterTopic(), event.subjectId(), json);
        }
    }

    private void send(String topic, String key, String json) {
        kafkaTemplate.send(topic, key, json).whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish to topic {} with key {}", topic, key, ex);
            } else {
                log.debug("Published to {} partition {} offset {}", topic,
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
    }
}
