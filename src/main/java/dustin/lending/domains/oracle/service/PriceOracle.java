package dustin.lending.domains.oracle.service;

import java.math.BigInteger;

/**
 * 가격 오라클
 * Price Oracle
 *
 * 자산의 현재 가격을 1e18 = 기준 통화 1단위로 반환합니다.
 * 원장 코어에는 읽기 전용입니다.
 */
public interface PriceOracle {

    /**
     * @param asset 자산 식별자
     * @return 현재 가격 (등록되지 않은 자산이면 ASSET_NOT_ACTIVE)
     */
    BigInteger price(String asset);
}
