package dustin.lending.domains.market.service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.config.LedgerProperties;
import dustin.lending.domains.market.model.dto.RegisterMarketRequest;
import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.kafka.model.LedgerEvent;
import dustin.lending.shared.kafka.model.LedgerEventType;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 마켓 관리 서비스
 * Market Admin Service
 *
 * 역할:
 * - 신규 마켓 등록 (리스크 파라미터 검증, 중복 검사)
 * - 오라클 가격 갱신
 *
 * 등록 시 연이율은 초당 이율로 한 번만 환산되며 이후 바뀌지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketAdminService {

    private final MarketRepository marketRepository;
    private final LedgerProperties ledgerProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * 마켓 등록
     * Register market
     *
     * 검증:
     * - 0 <= collateralFactor < liquidationThreshold <= 1e18
     * - 0 <= reserveFactor <= 1e18
     * - 연이율 >= 0, 초기 가격 > 0
     * - 자산 중복 불가
     *
     * @param request 등록 요청
     * @return 등록된 마켓
     */
    @Transactional
    public Market registerMarket(RegisterMarketRequest request) {
        validateRiskParameters(request);

        if (marketRepository.existsByAsset(request.getAsset())) {
            throw new LedgerException(LedgerErrorCode.ASSET_ALREADY_REGISTERED, request.getAsset());
        }

        BigInteger secondsPerYear = BigInteger.valueOf(ledgerProperties.getSecondsPerYear());
        long now = clock.instant().getEpochSecond();

        Market market = Market.builder()
                .asset(request.getAsset())
                .active(true)
                .totalSupplied(BigInteger.ZERO)
                .totalBorrowed(BigInteger.ZERO)
                .supplyRatePerSecond(request.getAnnualSupplyRate().divide(secondsPerYear))
                .borrowRatePerSecond(request.getAnnualBorrowRate().divide(secondsPerYear))
                .reserveFactor(request.getReserveFactor())
                .collateralFactor(request.getCollateralFactor())
                .liquidationThreshold(request.getLiquidationThreshold())
                .lastUpdateTime(now)
                .supplyIndex(WadMath.SCALE)
                .borrowIndex(WadMath.SCALE)
                .price(request.getInitialPrice())
                .build();
        Market saved = marketRepository.save(market);

        log.info("[MarketAdminService] 마켓 등록: asset={}, supplyRatePerSecond={}, borrowRatePerSecond={}, cf={}, lt={}, price={}",
                saved.getAsset(), saved.getSupplyRatePerSecond(), saved.getBorrowRatePerSecond(),
                saved.getCollateralFactor(), saved.getLiquidationThreshold(), saved.getPrice());

        eventPublisher.publishEvent(LedgerEvent.builder()
                .eventType(LedgerEventType.MARKET_REGISTERED)
                .asset(saved.getAsset())
                .amount(saved.getPrice())
                .timestamp(LocalDateTime.now(clock))
                .build());
        return saved;
    }

    /**
     * 가격 갱신
     * Update oracle price
     *
     * 가격은 이자 누적에 영향을 주지 않으므로 인덱스는 건드리지 않습니다.
     *
     * @param asset 자산
     * @param price 새 가격 (> 0)
     * @return 갱신된 마켓
     */
    @Transactional
    public Market updatePrice(String asset, BigInteger price) {
        if (!WadMath.isPositive(price)) {
            throw new LedgerException(LedgerErrorCode.INVALID_PRICE);
        }

        Market market = marketRepository.findByAssetForUpdate(asset)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset));
        BigInteger previous = market.getPrice();
        market.setPrice(price);

        log.info("[MarketAdminService] 가격 갱신: asset={}, {} -> {}", asset, previous, price);
        eventPublisher.publishEvent(LedgerEvent.builder()
                .eventType(LedgerEventType.PRICE_UPDATED)
                .asset(asset)
                .amount(price)
                .secondaryAmount(previous)
                .timestamp(LocalDateTime.now(clock))
                .build());
        return market;
    }

    private void validateRiskParameters(RegisterMarketRequest request) {
        BigInteger cf = request.getCollateralFactor();
        BigInteger lt = request.getLiquidationThreshold();
        BigInteger rf = request.getReserveFactor();

        if (cf.signum() < 0 || cf.compareTo(lt) >= 0 || lt.compareTo(WadMath.SCALE) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_RISK_PARAMETERS,
                    "require 0 <= collateralFactor < liquidationThreshold <= 1e18");
        }
        if (rf.signum() < 0 || rf.compareTo(WadMath.SCALE) > 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_RISK_PARAMETERS, "reserveFactor out of range");
        }
        if (request.getAnnualSupplyRate().signum() < 0 || request.getAnnualBorrowRate().signum() < 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_RISK_PARAMETERS, "negative rate");
        }
        if (!WadMath.isPositive(request.getInitialPrice())) {
            throw new LedgerException(LedgerErrorCode.INVALID_PRICE);
        }
    }
}
