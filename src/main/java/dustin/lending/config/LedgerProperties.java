package dustin.lending.config;

import java.math.BigInteger;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * 원장 설정
 * Ledger Properties
 *
 * 역할:
 * - application.yml의 ledger.* 설정 바인딩
 * - 청산 파라미터(close factor, incentive), 연간 초 수, 이자 스케줄러, 이벤트 발행 설정
 *
 * 모든 비율 값은 1e18 = 1.0 고정소수점 단위입니다.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * 1회 청산으로 상환 가능한 최대 부채 비율 (기본 0.5)
     */
    private BigInteger closeFactor = new BigInteger("500000000000000000");

    /**
     * 청산 보너스 (기본 1.08 = 8% 인센티브)
     */
    private BigInteger liquidationIncentive = new BigInteger("1080000000000000000");

    /**
     * 연이율을 초당 이율로 환산할 때 사용하는 1년의 초 수
     */
    private long secondsPerYear = 31_536_000L;

    private Accrual accrual = new Accrual();

    private Events events = new Events();

    @Data
    public static class Accrual {

        /**
         * 주기적 이자 누적 스케줄러 활성화 여부
         */
        private boolean enabled = true;

        /**
         * 스케줄러 실행 간격 (ms)
         */
        private long intervalMs = 15_000L;
    }

    @Data
    public static class Events {

        /**
         * Kafka 이벤트 발행 활성화 여부 (false면 로그만 남김)
         */
        private boolean kafkaEnabled = false;

        private String topic = "ledger-events";
    }
}
