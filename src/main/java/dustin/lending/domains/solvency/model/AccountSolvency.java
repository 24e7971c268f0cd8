package dustin.lending.domains.solvency.model;

import java.math.BigInteger;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 계정 지급능력 평가 결과
 * Account Solvency
 *
 * collateralValue (담보 인정 비율 기준)는 차입 한도,
 * liquidationValue (청산 임계값 기준)는 청산 가능 여부에 쓰입니다. 두 값은 서로 유도되지 않습니다.
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class AccountSolvency {

    private final BigInteger collateralValue;

    private final BigInteger liquidationValue;

    private final BigInteger borrowValue;

    /**
     * liquidationValue × 1e18 / borrowValue, 부채가 없으면 2^256 - 1
     */
    private final BigInteger healthFactor;

    private final boolean liquidatable;

    /**
     * 자산별 담보 인정 가치 (담보로 사용 중이고 공급 잔고가 있는 자산만)
     */
    private final Map<String, BigInteger> collateralValueByAsset;

    public BigInteger collateralValueOf(String asset) {
        return collateralValueByAsset.getOrDefault(asset, BigInteger.ZERO);
    }
}
