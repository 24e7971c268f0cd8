package dustin.lending.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 원장 공통 설정
 * Ledger Configuration
 *
 * 이자 누적은 초 단위 타임스탬프를 사용하므로 시계를 빈으로 주입받아
 * 테스트에서 시간을 제어할 수 있도록 합니다.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
