package dustin.lending.domains.market.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.model.dto.MarketResponse;
import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.math.WadMath;
import lombok.RequiredArgsConstructor;

/**
 * 마켓 조회 서비스
 * Market Query Service
 *
 * 상태를 변경하지 않습니다. 인덱스/총량은 조회 시점까지 투영합니다.
 */
@Service
@RequiredArgsConstructor
public class MarketQueryService {

    private final MarketRepository marketRepository;
    private final InterestAccrualEngine interestAccrualEngine;
    private final InterestAccrualService interestAccrualService;

    @Transactional(readOnly = true)
    public MarketResponse getMarket(String asset) {
        Market market = marketRepository.findByAsset(asset)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset));
        return toResponse(market, interestAccrualService.now());
    }

    @Transactional(readOnly = true)
    public List<MarketResponse> getAllMarkets() {
        long now = interestAccrualService.now();
        List<MarketResponse> result = new ArrayList<>();
        for (Market market : marketRepository.findAllByOrderByAssetAsc()) {
            result.add(toResponse(market, now));
        }
        return result;
    }

    private MarketResponse toResponse(Market market, long now) {
        InterestAccrualEngine.IndexProjection projection = interestAccrualEngine.project(market, now);

        BigInteger utilization = projection.totalSupplied().signum() > 0
                ? WadMath.mulDiv(projection.totalBorrowed(), WadMath.SCALE, projection.totalSupplied())
                : BigInteger.ZERO;

        return MarketResponse.builder()
                .asset(market.getAsset())
                .active(market.getActive())
                .totalSupplied(projection.totalSupplied())
                .totalBorrowed(projection.totalBorrowed())
                .utilization(utilization)
                .supplyRatePerSecond(market.getSupplyRatePerSecond())
                .borrowRatePerSecond(market.getBorrowRatePerSecond())
                .reserveFactor(market.getReserveFactor())
                .collateralFactor(market.getCollateralFactor())
                .liquidationThreshold(market.getLiquidationThreshold())
                .supplyIndex(projection.supplyIndex())
                .borrowIndex(projection.borrowIndex())
                .price(market.getPrice())
                .asOf(Math.max(now, market.getLastUpdateTime()))
                .build();
    }
}
