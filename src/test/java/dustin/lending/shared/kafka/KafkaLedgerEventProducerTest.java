package dustin.lending.shared.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import dustin.lending.config.LedgerProperties;
import dustin.lending.shared.kafka.model.LedgerEvent;
import dustin.lending.shared.kafka.model.LedgerEventType;

/**
 * Kafka 원장 이벤트 발행자 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class KafkaLedgerEventProducerTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private KafkaLedgerEventProducer producer;

    @BeforeEach
    void setUp() {
        producer = new KafkaLedgerEventProducer(kafkaTemplate, new LedgerProperties());
    }

    private LedgerEvent borrowed() {
        return LedgerEvent.builder()
                .eventType(LedgerEventType.BORROWED)
                .userId(7L)
                .asset("USDC")
                .amount(new BigInteger("1600000000000000000000"))
                .timestamp(LocalDateTime.of(2026, 1, 1, 0, 0))
                .build();
    }

    @Test
    @DisplayName("사용자 ID를 키로 snake_case JSON을 설정된 토픽에 발행한다")
    void publishesKeyedSnakeCasePayload() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(new CompletableFuture<SendResult<String, String>>());

        producer.publish(borrowed());

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("ledger-events"), eq("7"), payload.capture());
        assertThat(payload.getValue())
                .contains("\"event_type\":\"BORROWED\"")
                .contains("\"user_id\":7")
                .contains("\"amount\":1600000000000000000000")
                .contains("\"timestamp\":\"2026-01-01T00:00:00\"");
    }

    @Test
    @DisplayName("브로커 전송 실패는 호출자에게 전파되지 않는다")
    void sendFailureIsOnlyLogged() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        assertThatCode(() -> producer.publish(borrowed())).doesNotThrowAnyException();
    }
}
