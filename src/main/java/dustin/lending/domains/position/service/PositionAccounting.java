package dustin.lending.domains.position.service;

import java.math.BigInteger;

import org.springframework.stereotype.Component;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.position.model.entity.UserPosition;
import dustin.lending.domains.position.repository.UserPositionRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;

/**
 * 포지션 회계 처리
 * Position Accounting
 *
 * 역할:
 * - 인덱스 스냅샷 기반 잔고 재구성 (reconcile)
 * - 포지션 행 잠금/생성
 *
 * 재구성 공식:
 * ============
 * principal > 0 이면 principal = principal × index / snapshot (내림)
 * 항상 snapshot = index
 *
 * 예시:
 * - 공급 100e18 (snapshot 1.0e18), 현재 supplyIndex 1.05e18
 * - reconcile 후 principal = 105e18, snapshot = 1.05e18
 */
@Component
@RequiredArgsConstructor
public class PositionAccounting {

    private final UserPositionRepository userPositionRepository;

    /**
     * 원금 × 현재 인덱스 / 스냅샷 (상태 변경 없음)
     */
    public static BigInteger currentBalance(BigInteger principal, BigInteger currentIndex, BigInteger snapshot) {
        if (principal == null || principal.signum() <= 0) {
            return BigInteger.ZERO;
        }
        return principal.multiply(currentIndex).divide(snapshot);
    }

    public void reconcileSupply(UserPosition position, Market market) {
        position.setSuppliedAmount(currentBalance(
                position.getSuppliedAmount(), market.getSupplyIndex(), position.getSupplyIndexSnapshot()));
        position.setSupplyIndexSnapshot(market.getSupplyIndex());
    }

    public void reconcileBorrow(UserPosition position, Market market) {
        position.setBorrowedAmount(currentBalance(
                position.getBorrowedAmount(), market.getBorrowIndex(), position.getBorrowIndexSnapshot()));
        position.setBorrowIndexSnapshot(market.getBorrowIndex());
    }

    /**
     * 포지션 잠금, 없으면 현재 인덱스 스냅샷으로 생성
     *
     * 새 포지션은 누적 이자 0에서 시작합니다.
     */
    public UserPosition lockOrCreate(Long userId, Market market) {
        return userPositionRepository.findByUserIdAndAssetForUpdate(userId, market.getAsset())
                .orElseGet(() -> userPositionRepository.saveAndFlush(UserPosition.builder()
                        .userId(userId)
                        .asset(market.getAsset())
                        .suppliedAmount(BigInteger.ZERO)
                        .borrowedAmount(BigInteger.ZERO)
                        .supplyIndexSnapshot(market.getSupplyIndex())
                        .borrowIndexSnapshot(market.getBorrowIndex())
                        .collateral(false)
                        .build()));
    }

    /**
     * 기존 포지션 잠금 (없으면 errorCode)
     */
    public UserPosition lockExisting(Long userId, String asset, LedgerErrorCode errorCode) {
        return userPositionRepository.findByUserIdAndAssetForUpdate(userId, asset)
                .orElseThrow(() -> new LedgerException(errorCode, "userId=" + userId + ", asset=" + asset));
    }
}
