package io.eventasaurus.ticketing.infrastructure.kafka.producer;

import io.eventasaurus.ticketing.infrastructure.kafka.message.OrderConfirmedMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventProducer {

    static final String ORDER_CONFIRMED_TOPIC = "order-confirmed";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    /**
     * 주문 id 를 키로 발행해 같은 주문의 메시지는 같은 파티션으로 보낸다.
     * 발행 실패는 로그만 남긴다. 주문 상태는 이미 커밋되어 있다.
     */
    public void publishOrderConfirmed(OrderConfirmedMessage message) {
        kafkaTemplate.send(ORDER_CONFIRMED_TOPIC, String.valueOf(message.orderId()), message)
            .whenComplete((result, ex) -> {
                if (ex == null) {
                    var metadata = result.getRecordMetadata();
                    log.info("Kafka message published: orderId={}, topic={}, partition={}, offset={}",
                        message.orderId(),
                        metadata.topic(),
                        metadata.partition(),
                        metadata.offset()
                    );
                } else {
                    log.error("Failed to publish Kafka message: orderId={}, error={}",
                        message.orderId(),
                        ex.getMessage(),
                        ex
                    );
                }
            });
    }
}
