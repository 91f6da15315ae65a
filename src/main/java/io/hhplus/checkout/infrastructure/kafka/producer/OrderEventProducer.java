package io.hhplus.checkout.infrastructure.kafka.producer;

import io.hhplus.checkout.infrastructure.kafka.message.OrderEventMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "checkout.events.kafka", name = "enabled", havingValue = "true")
public class OrderEventProducer {

    static final String ORDER_EVENTS_TOPIC = "order-events";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public OrderEventProducer(@Qualifier("orderEventKafkaTemplate") KafkaTemplate<String, Object> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    public void publish(OrderEventMessage message) {
        kafkaTemplate.send(ORDER_EVENTS_TOPIC, String.valueOf(message.orderId()), message)
            .whenComplete((result, ex) -> {
                if (ex == null) {
                    var metadata = result.getRecordMetadata();
                    log.info("Kafka message published: type={}, orderId={}, topic={}, partition={}, offset={}",
                        message.eventType(),
                        message.orderId(),
                        metadata.topic(),
                        metadata.partition(),
                        metadata.offset()
                    );
                } else {
                    log.error("Failed to publish Kafka message: type={}, orderId={}, error={}",
                        message.eventType(),
                        message.orderId(),
                        ex.getMessage(),
                        ex
                    );
                }
            });
    }
}
