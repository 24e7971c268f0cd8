package dustin.lending.domains.solvency.model.dto;

import java.math.BigInteger;

import dustin.lending.domains.solvency.model.AccountSolvency;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 유동성 (차입 한도 / 청산 가능 여부)")
public class AccountLiquidityResponse {

    @Schema(description = "사용자 ID", example = "1")
    private Long userId;

    @Schema(description = "담보 인정 가치 (collateralFactor 기준, 차입 한도)")
    private BigInteger collateralValue;

    @Schema(description = "청산 기준 담보 가치 (liquidationThreshold 기준)")
    private BigInteger liquidationValue;

    @Schema(description = "부채 가치")
    private BigInteger borrowValue;

    @Schema(description = "헬스 팩터 (1e18 미만이면 청산 가능, 부채 없으면 2^256 - 1)")
    private BigInteger healthFactor;

    @Schema(description = "청산 가능 여부")
    private Boolean liquidatable;

    public static AccountLiquidityResponse from(Long userId, AccountSolvency solvency) {
        return AccountLiquidityResponse.builder()
                .userId(userId)
                .collateralValue(solvency.getCollateralValue())
                .liquidationValue(solvency.getLiquidationValue())
                .borrowValue(solvency.getBorrowValue())
                .healthFactor(solvency.getHealthFactor())
                .liquidatable(solvency.isLiquidatable())
                .build();
    }
}
