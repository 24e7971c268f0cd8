package dustin.lending.domains.market.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 등록 요청 DTO
 * Register Market Request DTO
 *
 * 모든 비율/가격은 1e18 = 1.0 고정소수점입니다.
 *
 * 예시 (연 공급 5%, 연 차입 8%, 담보 80%, 청산 85%, 가격 1.0):
 * {"asset":"USDC","annualSupplyRate":50000000000000000,"annualBorrowRate":80000000000000000,
 *  "reserveFactor":100000000000000000,"collateralFactor":800000000000000000,
 *  "liquidationThreshold":850000000000000000,"initialPrice":1000000000000000000}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "마켓 등록 요청")
public class RegisterMarketRequest {

    @NotBlank(message = "자산 식별자는 필수입니다")
    @Pattern(regexp = "^[A-Za-z0-9._-]{1,50}$", message = "자산 식별자는 영문/숫자/._- 1~50자여야 합니다")
    @Schema(description = "자산 식별자", example = "USDC", required = true)
    private String asset;

    @NotNull
    @Schema(description = "연 공급 이율 (1e18 = 100%)", example = "50000000000000000", required = true)
    private BigInteger annualSupplyRate;

    @NotNull
    @Schema(description = "연 차입 이율 (1e18 = 100%)", example = "80000000000000000", required = true)
    private BigInteger annualBorrowRate;

    @NotNull
    @Schema(description = "준비금 비율", example = "100000000000000000", required = true)
    private BigInteger reserveFactor;

    @NotNull
    @Schema(description = "담보 인정 비율 (청산 임계값보다 작아야 함)", example = "800000000000000000", required = true)
    private BigInteger collateralFactor;

    @NotNull
    @Schema(description = "청산 임계값 (1e18 이하)", example = "850000000000000000", required = true)
    private BigInteger liquidationThreshold;

    @NotNull
    @Schema(description = "초기 가격", example = "1000000000000000000", required = true)
    private BigInteger initialPrice;
}
