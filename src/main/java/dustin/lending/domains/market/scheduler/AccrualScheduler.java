package dustin.lending.domains.market.scheduler;

import java.util.List;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.domains.market.service.InterestAccrualService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 이자 누적 스케줄러
 * Accrual Scheduler
 *
 * 역할:
 * - 사용자 요청이 없어도 일정 주기로 모든 활성 마켓의 인덱스를 진행
 *
 * 마켓마다 별도 트랜잭션으로 누적합니다.
 * 한 마켓이 실패해도 나머지 마켓은 계속 처리합니다.
 *
 * 실행 주기: ledger.accrual.interval-ms (이전 실행 종료 후 기준)
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.accrual", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AccrualScheduler {

    private final MarketRepository marketRepository;
    private final InterestAccrualService interestAccrualService;

    @Scheduled(fixedDelayString = "${ledger.accrual.interval-ms:15000}")
    public void accrueActiveMarkets() {
        List<Market> markets = marketRepository.findByActiveTrueOrderByAssetAsc();
        int failed = 0;
        for (Market market : markets) {
            try {
                interestAccrualService.accrueMarket(market.getAsset());
            } catch (RuntimeException e) {
                failed++;
                log.error("[AccrualScheduler] 이자 누적 실패: asset={}, error={}", market.getAsset(), e.getMessage(), e);
            }
        }
        log.debug("[AccrualScheduler] 이자 누적 완료: markets={}, failed={}", markets.size(), failed);
    }
}
