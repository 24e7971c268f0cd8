package dustin.lending.domains.position.service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.domains.market.service.InterestAccrualEngine;
import dustin.lending.domains.market.service.InterestAccrualService;
import dustin.lending.domains.position.model.dto.PositionResponse;
import dustin.lending.domains.position.model.entity.UserPosition;
import dustin.lending.domains.position.repository.UserPositionRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;

/**
 * 포지션 조회 서비스
 * Position Query Service
 *
 * 현재 공급/차입 잔고를 투영된 인덱스로 계산합니다. 상태를 변경하지 않습니다.
 */
@Service
@RequiredArgsConstructor
public class PositionQueryService {

    private final UserPositionRepository userPositionRepository;
    private final MarketRepository marketRepository;
    private final InterestAccrualEngine interestAccrualEngine;
    private final InterestAccrualService interestAccrualService;

    /**
     * 현재 공급 잔고 (포지션 없으면 0)
     */
    @Transactional(readOnly = true)
    public BigInteger getSupplyBalance(Long userId, String asset) {
        return getPosition(userId, asset).getSupplyBalance();
    }

    /**
     * 현재 차입 잔고 (포지션 없으면 0)
     */
    @Transactional(readOnly = true)
    public BigInteger getBorrowBalance(Long userId, String asset) {
        return getPosition(userId, asset).getBorrowBalance();
    }

    @Transactional(readOnly = true)
    public PositionResponse getPosition(Long userId, String asset) {
        Market market = marketRepository.findByAsset(asset)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset));
        long now = interestAccrualService.now();
        return userPositionRepository.findByUserIdAndAsset(userId, asset)
                .map(position -> toResponse(position, market, now))
                .orElseGet(() -> PositionResponse.empty(userId, asset));
    }

    @Transactional(readOnly = true)
    public List<PositionResponse> getPositions(Long userId) {
        long now = interestAccrualService.now();
        List<PositionResponse> result = new ArrayList<>();
        for (UserPosition position : userPositionRepository.findByUserIdOrderByIdAsc(userId)) {
            Market market = marketRepository.findByAsset(position.getAsset())
                    .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, position.getAsset()));
            result.add(toResponse(position, market, now));
        }
        return result;
    }

    private PositionResponse toResponse(UserPosition position, Market market, long now) {
        InterestAccrualEngine.IndexProjection projection = interestAccrualEngine.project(market, now);
        return PositionResponse.builder()
                .userId(position.getUserId())
                .asset(position.getAsset())
                .supplyBalance(PositionAccounting.currentBalance(
                        position.getSuppliedAmount(), projection.supplyIndex(), position.getSupplyIndexSnapshot()))
                .borrowBalance(PositionAccounting.currentBalance(
                        position.getBorrowedAmount(), projection.borrowIndex(), position.getBorrowIndexSnapshot()))
                .collateral(position.isCollateralEnabled())
                .build();
    }
}
