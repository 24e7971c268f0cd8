package dustin.lending.domains.market.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import dustin.lending.domains.market.model.dto.MarketResponse;
import dustin.lending.domains.market.model.dto.RegisterMarketRequest;
import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.position.service.LendingService;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.support.LedgerIntegrationTestSupport;

/**
 * 마켓 등록 / 가격 갱신 / 조회 테스트
 */
class MarketAdminServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private MarketQueryService marketQueryService;

    @Autowired
    private InterestAccrualService interestAccrualService;

    @Autowired
    private LendingService lendingService;

    private RegisterMarketRequest.RegisterMarketRequestBuilder validRequest() {
        return RegisterMarketRequest.builder()
                .asset("ETH")
                .annualSupplyRate(new BigInteger("50000000000000000"))
                .annualBorrowRate(new BigInteger("80000000000000000"))
                .reserveFactor(new BigInteger("100000000000000000"))
                .collateralFactor(CF_80)
                .liquidationThreshold(LT_85)
                .initialPrice(units(2000));
    }

    private void assertRejected(RegisterMarketRequest request, LedgerErrorCode expected) {
        assertThatThrownBy(() -> marketAdminService.registerMarket(request))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("등록 시 연이율을 초당 이율로 환산하고 인덱스는 1.0에서 시작한다")
    void registerConvertsRates() {
        Market market = marketAdminService.registerMarket(validRequest().build());

        assertThat(market.getSupplyRatePerSecond()).isEqualTo(BigInteger.valueOf(1_585_489_599L));
        assertThat(market.getBorrowRatePerSecond()).isEqualTo(BigInteger.valueOf(2_536_783_358L));
        assertThat(market.getSupplyIndex()).isEqualTo(E18);
        assertThat(market.getBorrowIndex()).isEqualTo(E18);
        assertThat(market.getLastUpdateTime()).isEqualTo(clock.instant().getEpochSecond());
        assertThat(market.getActive()).isTrue();
    }

    @Test
    @DisplayName("같은 자산은 두 번 등록할 수 없다")
    void duplicateRegistration() {
        marketAdminService.registerMarket(validRequest().build());

        assertRejected(validRequest().build(), LedgerErrorCode.ASSET_ALREADY_REGISTERED);
    }

    @Test
    @DisplayName("담보 비율은 청산 임계값보다 작아야 하고 임계값은 1.0 이하")
    void riskParameterOrdering() {
        assertRejected(validRequest().collateralFactor(LT_85).build(), LedgerErrorCode.INVALID_RISK_PARAMETERS);
        assertRejected(validRequest().liquidationThreshold(E18.add(BigInteger.ONE)).build(),
                LedgerErrorCode.INVALID_RISK_PARAMETERS);
        assertRejected(validRequest().reserveFactor(E18.add(BigInteger.ONE)).build(),
                LedgerErrorCode.INVALID_RISK_PARAMETERS);
        assertRejected(validRequest().annualBorrowRate(BigInteger.valueOf(-1)).build(),
                LedgerErrorCode.INVALID_RISK_PARAMETERS);
        assertRejected(validRequest().initialPrice(BigInteger.ZERO).build(), LedgerErrorCode.INVALID_PRICE);
        assertThat(marketRepository.count()).isZero();
    }

    @Test
    @DisplayName("가격 갱신: 0 이하는 INVALID_PRICE, 미등록 자산은 ASSET_NOT_ACTIVE")
    void updatePrice() {
        marketAdminService.registerMarket(validRequest().build());

        marketAdminService.updatePrice("ETH", units(2500));
        assertThat(marketRepository.findByAsset("ETH").orElseThrow().getPrice()).isEqualTo(units(2500));

        assertThatThrownBy(() -> marketAdminService.updatePrice("ETH", BigInteger.ZERO))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.INVALID_PRICE);
        assertThatThrownBy(() -> marketAdminService.updatePrice("BTC", units(1)))
                .isInstanceOf(LedgerException.class)
                .extracting(e -> ((LedgerException) e).getErrorCode())
                .isEqualTo(LedgerErrorCode.ASSET_NOT_ACTIVE);
    }

    @Test
    @DisplayName("이용률 = 총 차입 / 총 공급, 조회는 누적 결과를 투영하지만 저장하지 않는다")
    void utilizationSummary() {
        registerMarket("ETH", units(2000));
        registerMarket("USDC", E18, BigInteger.ZERO, new BigInteger("80000000000000000"));
        mint(1L, "ETH", units(1));
        mint(2L, "USDC", units(4000));
        lendingService.supply(2L, "USDC", units(4000));
        lendingService.supply(1L, "ETH", units(1));
        lendingService.setCollateral(1L, "ETH", true);
        lendingService.borrow(1L, "USDC", units(1000));

        MarketResponse response = marketQueryService.getMarket("USDC");
        assertThat(response.getUtilization()).isEqualTo(new BigInteger("250000000000000000"));
        assertThat(response.getTotalBorrowed()).isEqualTo(units(1000));

        clock.advanceSeconds(SECONDS_PER_YEAR);
        MarketResponse projected = marketQueryService.getMarket("USDC");
        assertThat(projected.getBorrowIndex()).isEqualTo(new BigInteger("1079999999977888000"));
        assertThat(marketRepository.findByAsset("USDC").orElseThrow().getBorrowIndex()).isEqualTo(E18);

        interestAccrualService.accrueMarket("USDC");
        assertThat(marketRepository.findByAsset("USDC").orElseThrow().getBorrowIndex())
                .isEqualTo(new BigInteger("1079999999977888000"));
    }

    @Test
    @DisplayName("빈 마켓 이용률은 0")
    void emptyMarketUtilization() {
        registerMarket("ETH", units(2000));

        assertThat(marketQueryService.getMarket("ETH").getUtilization()).isZero();
        assertThat(marketQueryService.getAllMarkets()).hasSize(1);
    }
}
