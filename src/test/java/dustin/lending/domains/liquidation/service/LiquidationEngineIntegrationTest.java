package dustin.lending.domains.liquidation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import dustin.lending.domains.liquidation.model.entity.LiquidationRecord;
import dustin.lending.domains.position.service.LendingService;
import dustin.lending.domains.position.service.PositionQueryService;
import dustin.lending.domains.protocol.service.ProtocolStatusService;
import dustin.lending.domains.solvency.service.SolvencyEvaluator;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.support.LedgerIntegrationTestSupport;

/**
 * 청산 엔진 통합 테스트
 *
 * 기본 시나리오:
 * - 차입자 1: ETH 1개(2000) 담보로 USDC 1600 차입 (헬스 팩터 1.0625)
 * - ETH 가격 하락으로 헬스 팩터 < 1.0
 * - 청산인 3: USDC로 부채 일부 상환, ETH 담보 + 8% 보너스 수령
 */
class LiquidationEngineIntegrationTest extends LedgerIntegrationTestSupport {

    private static final long BORROWER = 1L;
    private static final long LENDER = 2L;
    private static final long LIQUIDATOR = 3L;
    private static final long DUST_BORROWER = 4L;

    @Autowired
    private LiquidationEngine liquidationEngine;

    @Autowired
    private LendingService lendingService;

    @Autowired
    private PositionQueryService positionQueryService;

    @Autowired
    private SolvencyEvaluator solvencyEvaluator;

    @Autowired
    private ProtocolStatusService protocolStatusService;

    @BeforeEach
    void setUpUnhealthyBorrower() {
        registerMarket("ETH", units(2000));
        registerMarket("USDC", E18);
        mint(BORROWER, "ETH", units(1));
        mint(LENDER, "USDC", units(10_000));
        mint(LIQUIDATOR, "USDC", units(1000));

        lendingService.supply(LENDER, "USDC", units(10_000));
        lendingService.supply(BORROWER, "ETH", units(1));
        lendingService.setCollateral(BORROWER, "ETH", true);
        lendingService.borrow(BORROWER, "USDC", units(1600));
    }

    @Test
    @DisplayName("건전한 계정은 NOT_LIQUIDATABLE")
    void healthyAccountCannotBeLiquidated() {
        assertThatThrownBy(() -> liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(100)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.NOT_LIQUIDATABLE);
    }

    @Test
    @DisplayName("close factor 초과 요청은 절삭된다: 부채 1600, 요청 1000 → 상환 800, 압류 0.48 ETH")
    void repayIsTruncatedToCloseFactor() {
        marketAdminService.updatePrice("ETH", units(1800));

        LiquidationRecord record = liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(1000));

        // seize = 800 × 1 × 1.08 / 1800 = 0.48 ETH
        BigInteger expectedSeize = new BigInteger("480000000000000000");
        assertThat(record.getRepayAmount()).isEqualTo(units(800));
        assertThat(record.getSeizeAmount()).isEqualTo(expectedSeize);
        assertThat(record.getRequestedRepayAmount()).isEqualTo(units(1000));
        // 청산 전 헬스 팩터 = 1530 / 1600
        assertThat(record.getHealthFactorBefore()).isEqualTo(new BigInteger("956250000000000000"));

        assertThat(positionQueryService.getBorrowBalance(BORROWER, "USDC")).isEqualTo(units(800));
        assertThat(positionQueryService.getSupplyBalance(BORROWER, "ETH")).isEqualTo(units(1).subtract(expectedSeize));
        assertThat(wallet(LIQUIDATOR, "USDC")).isEqualTo(units(200));
        assertThat(wallet(LIQUIDATOR, "ETH")).isEqualTo(expectedSeize);
        assertThat(marketRepository.findByAsset("USDC").orElseThrow().getTotalBorrowed()).isEqualTo(units(800));
        assertThat(marketRepository.findByAsset("ETH").orElseThrow().getTotalSupplied())
                .isEqualTo(units(1).subtract(expectedSeize));
    }

    @Test
    @DisplayName("가격이 같으면 압류량 = 상환량 × 1.08, 상환은 부채의 절반으로 제한")
    void equalPricesSeizeWithIncentive() {
        registerMarket("DAI", E18);
        registerMarket("USDT", E18, BigInteger.ZERO, E18);
        mint(10L, "DAI", units(1000));
        mint(11L, "USDT", units(5000));
        mint(LIQUIDATOR, "USDT", units(5000));
        lendingService.supply(11L, "USDT", units(5000));
        lendingService.supply(10L, "DAI", units(1000));
        lendingService.setCollateral(10L, "DAI", true);
        lendingService.borrow(10L, "USDT", units(800));

        // 연 100% 이율, 1년 후 부채 ≈ 1600 > 청산 기준 850
        clock.advanceSeconds(SECONDS_PER_YEAR);
        BigInteger debt = positionQueryService.getBorrowBalance(10L, "USDT");
        assertThat(solvencyEvaluator.evaluate(10L).isLiquidatable()).isTrue();

        LiquidationRecord record = liquidationEngine.liquidate(LIQUIDATOR, 10L, "USDT", "DAI", units(5000));

        BigInteger expectedRepay = debt.divide(BigInteger.TWO);
        assertThat(record.getRepayAmount()).isEqualTo(expectedRepay);
        assertThat(record.getSeizeAmount()).isEqualTo(expectedRepay.multiply(BigInteger.valueOf(108)).divide(BigInteger.valueOf(100)));
        assertThat(positionQueryService.getBorrowBalance(10L, "USDT")).isEqualTo(debt.subtract(expectedRepay));
    }

    @Test
    @DisplayName("자기 자신은 청산할 수 없다")
    void selfLiquidationDisallowed() {
        marketAdminService.updatePrice("ETH", units(1800));

        assertThatThrownBy(() -> liquidationEngine.liquidate(BORROWER, BORROWER, "USDC", "ETH", units(100)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.SELF_LIQUIDATION_DISALLOWED);
    }

    @Test
    @DisplayName("건전한 계정이라도 자기 청산은 NOT_LIQUIDATABLE보다 먼저 SELF_LIQUIDATION_DISALLOWED")
    void selfLiquidationDisallowedForHealthyAccount() {
        assertThat(solvencyEvaluator.evaluate(BORROWER).isLiquidatable()).isFalse();

        assertThatThrownBy(() -> liquidationEngine.liquidate(BORROWER, BORROWER, "USDC", "ETH", units(100)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.SELF_LIQUIDATION_DISALLOWED);
    }

    @Test
    @DisplayName("close factor 적용 후 상환액이 0이 되는 1 wei 부채는 INVALID_AMOUNT, 상태는 그대로")
    void dustDebtBelowCloseFactorGranularityRejected() {
        mint(DUST_BORROWER, "ETH", BigInteger.ONE);
        lendingService.supply(DUST_BORROWER, "ETH", BigInteger.ONE);
        lendingService.setCollateral(DUST_BORROWER, "ETH", true);
        lendingService.borrow(DUST_BORROWER, "USDC", BigInteger.ONE);

        // 청산 가치 = 1 × 1 × 0.85 → 0, 헬스 팩터 0
        marketAdminService.updatePrice("ETH", E18);
        assertThat(solvencyEvaluator.evaluate(DUST_BORROWER).isLiquidatable()).isTrue();

        // 최대 상환액 = 1 × 0.5 → 0
        assertThatThrownBy(() -> liquidationEngine.liquidate(LIQUIDATOR, DUST_BORROWER, "USDC", "ETH", units(1)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.INVALID_AMOUNT);

        assertThat(positionQueryService.getBorrowBalance(DUST_BORROWER, "USDC")).isEqualTo(BigInteger.ONE);
        assertThat(positionQueryService.getSupplyBalance(DUST_BORROWER, "ETH")).isEqualTo(BigInteger.ONE);
        assertThat(wallet(LIQUIDATOR, "USDC")).isEqualTo(units(1000));
        assertThat(liquidationRecordRepository.findByBorrowerIdOrderByIdDesc(DUST_BORROWER)).isEmpty();
    }

    @Test
    @DisplayName("상환 요청 0은 INVALID_AMOUNT")
    void zeroRepayRejected() {
        assertThatThrownBy(() -> liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", BigInteger.ZERO))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.INVALID_AMOUNT);
    }

    @Test
    @DisplayName("압류량이 담보를 초과하면 SEIZE_EXCEEDS_COLLATERAL, 작은 요청은 성공")
    void seizeExceedsCollateral() {
        marketAdminService.updatePrice("ETH", units(500));

        // 800 × 1.08 / 500 = 1.728 ETH > 1 ETH
        assertThatThrownBy(() -> liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(800)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.SEIZE_EXCEEDS_COLLATERAL);
        assertThat(wallet(LIQUIDATOR, "USDC")).isEqualTo(units(1000));
        assertThat(positionQueryService.getBorrowBalance(BORROWER, "USDC")).isEqualTo(units(1600));

        // 400 × 1.08 / 500 = 0.864 ETH
        LiquidationRecord record = liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(400));
        assertThat(record.getSeizeAmount()).isEqualTo(new BigInteger("864000000000000000"));
    }

    @Test
    @DisplayName("담보로 사용하지 않는 자산은 압류할 수 없다")
    void collateralAssetWithoutSupply() {
        marketAdminService.updatePrice("ETH", units(1800));

        assertThatThrownBy(() -> liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "USDC", units(100)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.NO_COLLATERAL_OR_NO_DEBT);
    }

    @Test
    @DisplayName("청산인 잔고가 부족하면 TRANSFER_FAILED, 전부 롤백")
    void liquidatorWithoutFunds() {
        marketAdminService.updatePrice("ETH", units(1800));

        assertThatThrownBy(() -> liquidationEngine.liquidate(4L, BORROWER, "USDC", "ETH", units(100)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.TRANSFER_FAILED);

        assertThat(positionQueryService.getBorrowBalance(BORROWER, "USDC")).isEqualTo(units(1600));
        assertThat(positionQueryService.getSupplyBalance(BORROWER, "ETH")).isEqualTo(units(1));
        assertThat(liquidationRecordRepository.count()).isZero();
    }

    @Test
    @DisplayName("일시 정지 중에는 청산도 PROTOCOL_PAUSED")
    void pausedRejectsLiquidation() {
        marketAdminService.updatePrice("ETH", units(1800));
        protocolStatusService.setPaused(true);

        assertThatThrownBy(() -> liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(100)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.PROTOCOL_PAUSED);
    }

    @Test
    @DisplayName("청산 이력은 차입자별로 최신순 조회된다")
    void historyByBorrower() {
        marketAdminService.updatePrice("ETH", units(1800));
        liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(100));
        liquidationEngine.liquidate(LIQUIDATOR, BORROWER, "USDC", "ETH", units(200));

        List<LiquidationRecord> history = liquidationEngine.getHistory(BORROWER);

        assertThat(history).hasSize(2);
        assertThat(history.get(0).getRepayAmount()).isEqualTo(units(200));
        assertThat(history.get(1).getRepayAmount()).isEqualTo(units(100));
        assertThat(liquidationEngine.getHistory(99L)).isEmpty();
    }
}
