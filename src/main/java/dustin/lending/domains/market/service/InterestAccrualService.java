package dustin.lending.domains.market.service;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 이자 누적 서비스
 * Interest Accrual Service
 *
 * 역할:
 * - 마켓 행을 비관적 락으로 잠근 뒤 InterestAccrualEngine으로 인덱스 갱신
 * - 여러 마켓을 잠글 때는 자산 이름 오름차순 (교착 방지)
 *
 * 같은 마켓에 대한 누적은 행 락으로 직렬화됩니다.
 * 인덱스 갱신은 호출 시점의 총량에 의존하므로 교환 법칙이 성립하지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterestAccrualService {

    private final MarketRepository marketRepository;
    private final InterestAccrualEngine interestAccrualEngine;
    private final Clock clock;

    /**
     * 현재 시각 (epoch seconds)
     */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    /**
     * 단일 마켓 이자 누적 (독립 트랜잭션)
     * Accrue one market in its own transaction
     *
     * 키퍼 API와 스케줄러에서 사용합니다. 락 획득 실패 시 재시도합니다.
     *
     * @param asset 자산
     * @return 누적 후 마켓
     */
    @Retryable(
            retryFor = PessimisticLockingFailureException.class,
            maxAttempts = 3,
            backoff = @Backoff(delay = 200, multiplier = 2)
    )
    @Transactional
    public Market accrueMarket(String asset) {
        Market market = lockAndAccrue(asset);
        log.debug("[InterestAccrualService] 이자 누적: asset={}, supplyIndex={}, borrowIndex={}",
                asset, market.getSupplyIndex(), market.getBorrowIndex());
        return market;
    }

    /**
     * 마켓 잠금 + 누적 (호출자 트랜잭션 필요)
     *
     * @param asset 자산
     * @return 잠기고 현재 시각까지 누적된 마켓
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Market lockAndAccrue(String asset) {
        Market market = marketRepository.findByAssetForUpdate(asset)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset));
        interestAccrualEngine.accrue(market, now());
        return market;
    }

    /**
     * 여러 마켓 잠금 + 누적 (자산 오름차순, 중복 제거)
     *
     * @param assets 자산 목록
     * @return 자산 → 마켓
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<String, Market> lockAndAccrue(Collection<String> assets) {
        Map<String, Market> markets = new LinkedHashMap<>();
        for (String asset : new TreeSet<>(assets)) {
            markets.put(asset, lockAndAccrue(asset));
        }
        return markets;
    }
}
