package dustin.lending.shared.kafka.model;

import java.math.BigInteger;
import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 원장 이벤트
 * Ledger Event
 *
 * 커밋이 완료된 상태 변경마다 하나씩 발행됩니다.
 * 청산 이벤트는 counterparty(청산인), secondary(담보 자산/압류 수량)를 함께 채웁니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEvent {

    @JsonProperty("event_type")
    private LedgerEventType eventType;

    /**
     * 대상 사용자 ID (청산의 경우 차입자)
     */
    @JsonProperty("user_id")
    private Long userId;

    /**
     * 상대방 사용자 ID (청산인)
     */
    @JsonProperty("counterparty_id")
    private Long counterpartyId;

    @JsonProperty("asset")
    private String asset;

    @JsonProperty("amount")
    private BigInteger amount;

    @JsonProperty("secondary_asset")
    private String secondaryAsset;

    @JsonProperty("secondary_amount")
    private BigInteger secondaryAmount;

    @JsonProperty("flag")
    private Boolean flag;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;
}
