package dustin.lending.shared.kafka;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import dustin.lending.config.LedgerProperties;
import dustin.lending.shared.kafka.model.LedgerEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Kafka 원장 이벤트 발행자
 * Kafka Ledger Event Producer
 *
 * 역할:
 * - 커밋된 원장 변경 이벤트를 Kafka로 발행
 * - 비동기 처리 (논블로킹)
 *
 * 주의사항:
 * - 발행 실패는 로그만 남기며 원장 상태에는 영향 없음
 * - 메시지 키는 사용자 ID (같은 사용자의 이벤트 순서 보장)
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ledger.events", name = "kafka-enabled", havingValue = "true")
public class KafkaLedgerEventProducer {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public KafkaLedgerEventProducer(KafkaTemplate<String, String> kafkaTemplate, LedgerProperties ledgerProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = ledgerProperties.getEvents().getTopic();
    }

    /**
     * 원장 이벤트 발행
     * Publish ledger event
     *
     * @param event 커밋된 원장 이벤트
     */
    public void publish(LedgerEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("[KafkaLedgerEventProducer] 이벤트 직렬화 실패: type={}", event.getEventType(), e);
            return;
        }

        String key = event.getUserId() != null ? event.getUserId().toString() : event.getAsset();
        kafkaTemplate.send(topic, key, payload)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("[KafkaLedgerEventProducer] 이벤트 발행 실패: type={}, userId={}, error={}",
                                event.getEventType(), event.getUserId(), ex.getMessage());
                    } else {
                        log.debug("[KafkaLedgerEventProducer] 이벤트 발행 완료: type={}, offset={}",
                                event.getEventType(), result.getRecordMetadata().offset());
                    }
                });
    }
}
