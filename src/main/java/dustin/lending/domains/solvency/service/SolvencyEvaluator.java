package dustin.lending.domains.solvency.service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.domains.market.service.InterestAccrualEngine;
import dustin.lending.domains.market.service.InterestAccrualService;
import dustin.lending.domains.oracle.service.PriceOracle;
import dustin.lending.domains.position.model.entity.UserPosition;
import dustin.lending.domains.position.repository.UserPositionRepository;
import dustin.lending.domains.position.service.PositionAccounting;
import dustin.lending.domains.solvency.model.AccountSolvency;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;

/**
 * 지급능력 평가기
 * Solvency Evaluator
 *
 * 역할:
 * - 사용자의 모든 포지션을 현재 가격으로 평가
 * - 차입/출금/담보 해제 가능 여부 판단
 *
 * 평가 방식:
 * ==========
 * 각 포지션 잔고는 현재 시각까지 투영한 인덱스로 재구성합니다 (저장하지 않음).
 * 호출자가 이미 잠그고 누적한 마켓은 경과 시간이 0이므로 같은 값이 나옵니다.
 *
 * - 담보 자산 (collateral && 공급 > 0):
 *   collateralValue  += supplied × price × collateralFactor / 1e36
 *   liquidationValue += supplied × price × liquidationThreshold / 1e36
 * - 차입 자산 (borrowed > 0):
 *   borrowValue += borrowed × price / 1e18
 * - healthFactor = liquidationValue × 1e18 / borrowValue (부채 없으면 2^256 - 1)
 * - liquidatable = healthFactor < 1e18
 *
 * 예시 (담보 80% / 청산 85%):
 * - ETH 1개 (가격 2000) 담보 → collateralValue 1600, liquidationValue 1700
 * - USDC 1600 차입 가능, 1601은 불가
 */
@Service
@RequiredArgsConstructor
public class SolvencyEvaluator {

    private final UserPositionRepository userPositionRepository;
    private final MarketRepository marketRepository;
    private final InterestAccrualEngine interestAccrualEngine;
    private final InterestAccrualService interestAccrualService;
    private final PriceOracle priceOracle;

    /**
     * 계정 평가
     * Evaluate account
     *
     * @param userId 사용자 ID
     * @return 평가 결과
     */
    @Transactional(readOnly = true)
    public AccountSolvency evaluate(Long userId) {
        List<UserPosition> positions = userPositionRepository.findByUserIdOrderByIdAsc(userId);
        Map<String, Market> markets = marketRepository.findByAssetIn(
                        positions.stream().map(UserPosition::getAsset).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Market::getAsset, Function.identity()));
        long now = interestAccrualService.now();

        BigInteger collateralValue = BigInteger.ZERO;
        BigInteger liquidationValue = BigInteger.ZERO;
        BigInteger borrowValue = BigInteger.ZERO;
        Map<String, BigInteger> collateralValueByAsset = new LinkedHashMap<>();

        for (UserPosition position : positions) {
            Market market = markets.get(position.getAsset());
            if (market == null) {
                throw new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, position.getAsset());
            }
            InterestAccrualEngine.IndexProjection projection = interestAccrualEngine.project(market, now);

            BigInteger supplied = PositionAccounting.currentBalance(
                    position.getSuppliedAmount(), projection.supplyIndex(), position.getSupplyIndexSnapshot());
            BigInteger borrowed = PositionAccounting.currentBalance(
                    position.getBorrowedAmount(), projection.borrowIndex(), position.getBorrowIndexSnapshot());
            if (supplied.signum() == 0 && borrowed.signum() == 0) {
                continue;
            }

            BigInteger price = priceOracle.price(position.getAsset());

            if (position.isCollateralEnabled() && supplied.signum() > 0) {
                BigInteger assetCollateral = WadMath.mulDiv(
                        supplied, price, market.getCollateralFactor(), WadMath.SCALE_SQUARED);
                collateralValue = collateralValue.add(assetCollateral);
                liquidationValue = liquidationValue.add(WadMath.mulDiv(
                        supplied, price, market.getLiquidationThreshold(), WadMath.SCALE_SQUARED));
                collateralValueByAsset.put(position.getAsset(), assetCollateral);
            }
            if (borrowed.signum() > 0) {
                borrowValue = borrowValue.add(WadMath.mulDiv(borrowed, price, WadMath.SCALE));
            }
        }

        BigInteger healthFactor = borrowValue.signum() > 0
                ? WadMath.mulDiv(liquidationValue, WadMath.SCALE, borrowValue)
                : WadMath.MAX_UINT256;

        return AccountSolvency.builder()
                .collateralValue(collateralValue)
                .liquidationValue(liquidationValue)
                .borrowValue(borrowValue)
                .healthFactor(healthFactor)
                .liquidatable(healthFactor.compareTo(WadMath.SCALE) < 0)
                .collateralValueByAsset(collateralValueByAsset)
                .build();
    }

    /**
     * 추가 차입 가능 여부: collateralValue >= borrowValue + amount × price / 1e18
     */
    @Transactional(readOnly = true)
    public boolean canBorrow(Long userId, String asset, BigInteger amount) {
        AccountSolvency solvency = evaluate(userId);
        BigInteger additional = WadMath.mulDiv(amount, priceOracle.price(asset), WadMath.SCALE);
        return solvency.getCollateralValue().compareTo(solvency.getBorrowValue().add(additional)) >= 0;
    }

    /**
     * 담보 자산 출금 후에도 지급능력 유지 여부
     *
     * collateralValue - amount × price × collateralFactor / 1e36 >= borrowValue
     */
    @Transactional(readOnly = true)
    public boolean remainsSolventAfterWithdraw(Long userId, String asset, BigInteger amount) {
        AccountSolvency solvency = evaluate(userId);
        Market market = marketRepository.findByAsset(asset)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset));
        BigInteger removed = WadMath.mulDiv(
                amount, priceOracle.price(asset), market.getCollateralFactor(), WadMath.SCALE_SQUARED);
        return solvency.getCollateralValue().subtract(removed).compareTo(solvency.getBorrowValue()) >= 0;
    }

    /**
     * 해당 자산을 담보에서 제외해도 지급능력 유지 여부
     */
    @Transactional(readOnly = true)
    public boolean remainsSolventWithoutCollateral(Long userId, String asset) {
        AccountSolvency solvency = evaluate(userId);
        return solvency.getCollateralValue().subtract(solvency.collateralValueOf(asset))
                .compareTo(solvency.getBorrowValue()) >= 0;
    }
}
