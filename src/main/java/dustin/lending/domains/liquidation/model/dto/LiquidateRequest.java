package dustin.lending.domains.liquidation.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청산 요청 DTO
 * Liquidate Request DTO
 *
 * 청산인은 X-User-Id 헤더로 식별합니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "청산 요청")
public class LiquidateRequest {

    @NotNull(message = "차입자 ID는 필수입니다")
    @Schema(description = "청산 대상 차입자 ID", example = "2", required = true)
    private Long borrowerId;

    @NotBlank
    @Schema(description = "상환할 부채 자산", example = "USDC", required = true)
    private String borrowAsset;

    @NotBlank
    @Schema(description = "압류할 담보 자산", example = "ETH", required = true)
    private String collateralAsset;

    @NotNull
    @Schema(description = "상환 요청 수량 (close factor 한도를 넘으면 절삭)", required = true)
    private BigInteger repayAmount;
}
