package dustin.lending.domains.liquidation.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.config.LedgerProperties;
import dustin.lending.domains.liquidation.model.entity.LiquidationRecord;
import dustin.lending.domains.liquidation.repository.LiquidationRecordRepository;
import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.service.InterestAccrualService;
import dustin.lending.domains.oracle.service.PriceOracle;
import dustin.lending.domains.position.model.entity.UserPosition;
import dustin.lending.domains.position.service.AccountLockService;
import dustin.lending.domains.position.service.PositionAccounting;
import dustin.lending.domains.protocol.service.ProtocolStatusService;
import dustin.lending.domains.solvency.model.AccountSolvency;
import dustin.lending.domains.solvency.service.SolvencyEvaluator;
import dustin.lending.domains.wallet.service.AssetTransferGateway;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.kafka.model.LedgerEvent;
import dustin.lending.shared.kafka.model.LedgerEventType;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 청산 엔진
 * Liquidation Engine
 *
 * 역할:
 * - 헬스 팩터가 1.0 미만인 계정의 부채 일부를 제3자가 대신 상환
 * - 상환 가치 × 청산 보너스만큼 차입자의 담보를 청산인에게 이전
 *
 * 정산 공식:
 * ==========
 * - maxRepay = debt × closeFactor / 1e18  (closeFactor 기본 0.5)
 * - actualRepay = min(repayAmount, maxRepay)  (초과 요청은 거부하지 않고 절삭)
 * - seizeAmount = actualRepay × price(borrowAsset) × incentive / (price(collateralAsset) × 1e18)
 *
 * 예시 (가격 동일, incentive 1.08):
 * - 부채 1000, 요청 800 → 상환 500, 압류 540
 *
 * 락:
 * - 차입자 원장 계정만 잠급니다 (청산인 계정은 원장 포지션이 바뀌지 않음)
 * - 두 마켓은 자산 이름 오름차순으로 잠급니다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidationEngine {

    private final ProtocolStatusService protocolStatusService;
    private final AccountLockService accountLockService;
    private final InterestAccrualService interestAccrualService;
    private final PositionAccounting positionAccounting;
    private final SolvencyEvaluator solvencyEvaluator;
    private final PriceOracle priceOracle;
    private final AssetTransferGateway assetTransferGateway;
    private final LiquidationRecordRepository liquidationRecordRepository;
    private final LedgerProperties ledgerProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 청산
     * Liquidate
     *
     * @param liquidatorId 청산인 ID
     * @param borrowerId 차입자 ID
     * @param borrowAsset 상환할 부채 자산
     * @param collateralAsset 압류할 담보 자산
     * @param repayAmount 상환 요청 수량
     * @return 청산 이력 (실제 상환 수량, 압류 수량 포함)
     */
    @Transactional
    public LiquidationRecord liquidate(Long liquidatorId, Long borrowerId, String borrowAsset,
                                       String collateralAsset, BigInteger repayAmount) {
        if (!WadMath.isPositive(repayAmount)) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT);
        }
        if (liquidatorId == null || liquidatorId <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_USER, String.valueOf(liquidatorId));
        }
        if (liquidatorId.equals(borrowerId)) {
            throw new LedgerException(LedgerErrorCode.SELF_LIQUIDATION_DISALLOWED);
        }
        protocolStatusService.assertNotPaused();
        accountLockService.lock(borrowerId);

        Map<String, Market> markets = interestAccrualService.lockAndAccrue(List.of(borrowAsset, collateralAsset));
        Market borrowMarket = markets.get(borrowAsset);
        Market collateralMarket = markets.get(collateralAsset);

        AccountSolvency solvency = solvencyEvaluator.evaluate(borrowerId);
        if (!solvency.isLiquidatable()) {
            throw new LedgerException(LedgerErrorCode.NOT_LIQUIDATABLE,
                    "healthFactor=" + solvency.getHealthFactor());
        }

        UserPosition debtPosition = positionAccounting.lockExisting(
                borrowerId, borrowAsset, LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT);
        UserPosition collateralPosition = positionAccounting.lockExisting(
                borrowerId, collateralAsset, LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT);
        positionAccounting.reconcileBorrow(debtPosition, borrowMarket);
        positionAccounting.reconcileSupply(collateralPosition, collateralMarket);

        BigInteger debt = debtPosition.getBorrowedAmount();
        if (debt.signum() <= 0
                || !collateralPosition.isCollateralEnabled()
                || collateralPosition.getSuppliedAmount().signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT);
        }

        BigInteger maxRepay = WadMath.mulDiv(debt, ledgerProperties.getCloseFactor(), WadMath.SCALE);
        BigInteger actualRepay = repayAmount.min(maxRepay);
        if (actualRepay.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_AMOUNT, "repay rounds to zero under close factor");
        }

        BigInteger borrowPrice = priceOracle.price(borrowAsset);
        BigInteger collateralPrice = priceOracle.price(collateralAsset);
        BigInteger seizeAmount = WadMath.mulDiv(
                actualRepay, borrowPrice, ledgerProperties.getLiquidationIncentive(),
                collateralPrice.multiply(WadMath.SCALE));
        if (seizeAmount.compareTo(collateralPosition.getSuppliedAmount()) > 0) {
            throw new LedgerException(LedgerErrorCode.SEIZE_EXCEEDS_COLLATERAL,
                    "seize " + seizeAmount + " > collateral " + collateralPosition.getSuppliedAmount());
        }

        assetTransferGateway.pull(borrowAsset, liquidatorId, actualRepay);

        debtPosition.setBorrowedAmount(debt.subtract(actualRepay));
        borrowMarket.setTotalBorrowed(WadMath.saturatingSubtract(borrowMarket.getTotalBorrowed(), actualRepay));
        collateralPosition.setSuppliedAmount(collateralPosition.getSuppliedAmount().subtract(seizeAmount));
        collateralMarket.setTotalSupplied(WadMath.saturatingSubtract(collateralMarket.getTotalSupplied(), seizeAmount));

        assetTransferGateway.push(collateralAsset, liquidatorId, seizeAmount);

        LiquidationRecord record = liquidationRecordRepository.save(LiquidationRecord.builder()
                .liquidatorId(liquidatorId)
                .borrowerId(borrowerId)
                .borrowAsset(borrowAsset)
                .collateralAsset(collateralAsset)
                .requestedRepayAmount(repayAmount)
                .repayAmount(actualRepay)
                .seizeAmount(seizeAmount)
                .borrowAssetPrice(borrowPrice)
                .collateralAssetPrice(collateralPrice)
                .healthFactorBefore(solvency.getHealthFactor())
                .createdAt(LocalDateTime.now(clock))
                .build());

        log.info("[LiquidationEngine] 청산 완료: liquidatorId={}, borrowerId={}, borrowAsset={}, collateralAsset={}, repay={}, seize={}, healthFactorBefore={}",
                liquidatorId, borrowerId, borrowAsset, collateralAsset, actualRepay, seizeAmount, solvency.getHealthFactor());
        eventPublisher.publishEvent(LedgerEvent.builder()
                .eventType(LedgerEventType.LIQUIDATED)
                .userId(borrowerId)
                .counterpartyId(liquidatorId)
                .asset(borrowAsset)
                .amount(actualRepay)
                .secondaryAsset(collateralAsset)
                .secondaryAmount(seizeAmount)
                .timestamp(LocalDateTime.now(clock))
                .build());
        return record;
    }

    @Transactional(readOnly = true)
    public List<LiquidationRecord> getHistory(Long borrowerId) {
        if (borrowerId == null) {
            return liquidationRecordRepository.findTop100ByOrderByIdDesc();
        }
        return liquidationRecordRepository.findByBorrowerIdOrderByIdDesc(borrowerId);
    }
}
