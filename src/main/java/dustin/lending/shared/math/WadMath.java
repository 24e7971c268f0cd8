package dustin.lending.shared.math;

import java.math.BigInteger;

/**
 * 고정소수점 연산 유틸리티
 * Fixed-point (1e18) arithmetic helpers
 *
 * 규칙:
 * - 모든 값은 부호 없는 정수 (음수 불가)
 * - 나눗셈은 항상 내림 (floor), 반올림하지 않음
 * - 잔여 먼지(dust)는 사용자가 아닌 프로토콜 쪽에 남음
 */
public final class WadMath {

    /**
     * 1.0 을 나타내는 스케일 (1e18)
     */
    public static final BigInteger SCALE = BigInteger.TEN.pow(18);

    /**
     * SCALE²
     */
    public static final BigInteger SCALE_SQUARED = SCALE.multiply(SCALE);

    /**
     * 부채가 없을 때의 헬스 팩터 (uint256 최대값)
     */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private WadMath() {
    }

    /**
     * a × b / denominator (내림)
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator) {
        return a.multiply(b).divide(denominator);
    }

    /**
     * a × b × c / denominator (내림, 중간 결과 절사 없음)
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger c, BigInteger denominator) {
        return a.multiply(b).multiply(c).divide(denominator);
    }

    /**
     * a - b, 결과가 음수면 0
     */
    public static BigInteger saturatingSubtract(BigInteger a, BigInteger b) {
        BigInteger result = a.subtract(b);
        return result.signum() < 0 ? BigInteger.ZERO : result;
    }

    public static boolean isPositive(BigInteger value) {
        return value != null && value.signum() > 0;
    }
}
