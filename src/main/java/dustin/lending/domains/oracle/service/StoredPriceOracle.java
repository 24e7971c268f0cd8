package dustin.lending.domains.oracle.service;

import java.math.BigInteger;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.market.model.entity.Market;
import dustin.lending.domains.market.repository.MarketRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;

/**
 * 저장된 가격 기반 오라클
 * Stored Price Oracle
 *
 * 관리자가 기록한 마켓 가격(markets.price)을 그대로 반환합니다.
 * 단일 신뢰 가격 소스를 가정합니다.
 */
@Service
@RequiredArgsConstructor
public class StoredPriceOracle implements PriceOracle {

    private final MarketRepository marketRepository;

    @Override
    @Transactional(readOnly = true)
    public BigInteger price(String asset) {
        return marketRepository.findByAsset(asset)
                .map(Market::getPrice)
                .orElseThrow(() -> new LedgerException(LedgerErrorCode.ASSET_NOT_ACTIVE, asset));
    }
}
