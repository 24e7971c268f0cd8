package dustin.lending.domains.liquidation.model.dto;

import java.math.BigInteger;
import java.time.LocalDateTime;

import dustin.lending.domains.liquidation.model.entity.LiquidationRecord;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "청산 결과")
public class LiquidationResponse {

    private Long id;
    private Long liquidatorId;
    private Long borrowerId;
    private String borrowAsset;
    private String collateralAsset;

    @Schema(description = "상환 요청 수량")
    private BigInteger requestedRepayAmount;

    @Schema(description = "실제 상환 수량")
    private BigInteger repayAmount;

    @Schema(description = "압류 담보 수량")
    private BigInteger seizeAmount;

    private BigInteger borrowAssetPrice;
    private BigInteger collateralAssetPrice;

    @Schema(description = "청산 전 헬스 팩터")
    private BigInteger healthFactorBefore;

    private LocalDateTime createdAt;

    public static LiquidationResponse from(LiquidationRecord record) {
        return LiquidationResponse.builder()
                .id(record.getId())
                .liquidatorId(record.getLiquidatorId())
                .borrowerId(record.getBorrowerId())
                .borrowAsset(record.getBorrowAsset())
                .collateralAsset(record.getCollateralAsset())
                .requestedRepayAmount(record.getRequestedRepayAmount())
                .repayAmount(record.getRepayAmount())
                .seizeAmount(record.getSeizeAmount())
                .borrowAssetPrice(record.getBorrowAssetPrice())
                .collateralAssetPrice(record.getCollateralAssetPrice())
                .healthFactorBefore(record.getHealthFactorBefore())
                .createdAt(record.getCreatedAt())
                .build();
    }
}
