package dustin.lending.shared.kafka;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import dustin.lending.shared.kafka.model.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 원장 이벤트 릴레이
 * Ledger Event Relay
 *
 * 트랜잭션 커밋 이후에만 이벤트를 외부로 전달합니다.
 * 롤백된 작업의 이벤트는 발행되지 않습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerEventRelay {

    private final ObjectProvider<KafkaLedgerEventProducer> producerProvider;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onLedgerEvent(LedgerEvent event) {
        log.debug("[LedgerEventRelay] type={}, userId={}, asset={}, amount={}",
                event.getEventType(), event.getUserId(), event.getAsset(), event.getAmount());

        KafkaLedgerEventProducer producer = producerProvider.getIfAvailable();
        if (producer != null) {
            producer.publish(event);
        }
    }
}
