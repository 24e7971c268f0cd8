package dustin.lending.domains.market.service;

import java.math.BigInteger;

import org.springframework.stereotype.Component;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.shared.math.WadMath;

/**
 * 이자 누적 엔진
 * Interest Accrual Engine
 *
 * 역할:
 * - 마켓 인덱스를 현재 시각까지 진행
 * - 경과 시간 × 초당 이율을 총량에 반영
 *
 * 누적 방식 (호출 단위 복리):
 * ==========================
 * 한 번의 호출 안에서는 경과 시간에 대해 선형이지만, 호출 시점의 총량을 기준으로
 * 인덱스에 더해지므로 호출이 반복될수록 복리가 됩니다.
 * 자주 호출할수록 연속 복리에 가까워지고, 드물게 호출하면 덜 복리됩니다.
 * 이 근사식은 지급능력 계산이 그대로 의존하므로 바꾸지 않습니다.
 *
 * 예시:
 * - totalBorrowed = 1000e18, 연 8%, 1년 경과 후 1회 호출
 * - borrowInterest = 1000e18 × (8e16 / 31536000) × 31536000 / 1e18 ≈ 80e18
 * - borrowIndex: 1e18 → ≈ 1.08e18
 */
@Component
public class InterestAccrualEngine {

    /**
     * 마켓을 현재 시각까지 누적 (상태 변경)
     * Accrue market in place
     *
     * @param market 대상 마켓 (호출자가 락을 보유해야 함)
     * @param now 현재 시각 (epoch seconds)
     * @return 인덱스/총량이 실제로 변경되었으면 true
     */
    public boolean accrue(Market market, long now) {
        IndexProjection projection = project(market, now);
        if (projection.elapsedSeconds() <= 0) {
            return false;
        }

        market.setSupplyIndex(projection.supplyIndex());
        market.setBorrowIndex(projection.borrowIndex());
        market.setTotalSupplied(projection.totalSupplied());
        market.setTotalBorrowed(projection.totalBorrowed());
        market.setLastUpdateTime(now);
        return true;
    }

    /**
     * 읽기 전용 누적 투영
     * Read-only projection of accrue
     *
     * accrue와 동일한 계산을 하되 마켓을 변경하지 않습니다.
     * now가 lastUpdateTime 이하이면 현재 값을 그대로 반환합니다 (인덱스는 뒤로 가지 않음).
     */
    public IndexProjection project(Market market, long now) {
        long elapsed = now - market.getLastUpdateTime();
        if (elapsed <= 0) {
            return new IndexProjection(
                    market.getSupplyIndex(),
                    market.getBorrowIndex(),
                    market.getTotalSupplied(),
                    market.getTotalBorrowed(),
                    0L);
        }

        BigInteger elapsedSeconds = BigInteger.valueOf(elapsed);

        BigInteger borrowIndex = market.getBorrowIndex();
        BigInteger totalBorrowed = market.getTotalBorrowed();
        if (totalBorrowed.signum() > 0) {
            BigInteger borrowInterest = WadMath.mulDiv(
                    totalBorrowed, market.getBorrowRatePerSecond(), elapsedSeconds, WadMath.SCALE);
            borrowIndex = borrowIndex.add(WadMath.mulDiv(borrowInterest, WadMath.SCALE, totalBorrowed));
            totalBorrowed = totalBorrowed.add(borrowInterest);
        }

        BigInteger supplyIndex = market.getSupplyIndex();
        BigInteger totalSupplied = market.getTotalSupplied();
        if (totalSupplied.signum() > 0) {
            BigInteger supplyInterest = WadMath.mulDiv(
                    totalSupplied, market.getSupplyRatePerSecond(), elapsedSeconds, WadMath.SCALE);
            supplyIndex = supplyIndex.add(WadMath.mulDiv(supplyInterest, WadMath.SCALE, totalSupplied));
            totalSupplied = totalSupplied.add(supplyInterest);
        }

        return new IndexProjection(supplyIndex, borrowIndex, totalSupplied, totalBorrowed, elapsed);
    }

    /**
     * 투영 결과
     */
    public record IndexProjection(
            BigInteger supplyIndex,
            BigInteger borrowIndex,
            BigInteger totalSupplied,
            BigInteger totalBorrowed,
            long elapsedSeconds) {
    }
}
