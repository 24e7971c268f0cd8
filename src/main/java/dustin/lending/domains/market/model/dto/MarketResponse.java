package dustin.lending.domains.market.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 응답 DTO (자산 이용률 요약)
 * Market Response DTO
 *
 * 총량과 인덱스는 조회 시점까지 읽기 전용으로 투영한 값입니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "마켓 정보 및 이용률 요약")
public class MarketResponse {

    @Schema(description = "자산 식별자", example = "USDC")
    private String asset;

    @Schema(description = "활성화 여부", example = "true")
    private Boolean active;

    @Schema(description = "총 공급량 (이자 포함)")
    private BigInteger totalSupplied;

    @Schema(description = "총 차입량 (이자 포함)")
    private BigInteger totalBorrowed;

    /**
     * 이용률 = totalBorrowed × 1e18 / totalSupplied (공급 0이면 0)
     */
    @Schema(description = "이용률 (1e18 = 100%)")
    private BigInteger utilization;

    @Schema(description = "초당 공급 이율")
    private BigInteger supplyRatePerSecond;

    @Schema(description = "초당 차입 이율")
    private BigInteger borrowRatePerSecond;

    @Schema(description = "준비금 비율")
    private BigInteger reserveFactor;

    @Schema(description = "담보 인정 비율")
    private BigInteger collateralFactor;

    @Schema(description = "청산 임계값")
    private BigInteger liquidationThreshold;

    @Schema(description = "공급 인덱스")
    private BigInteger supplyIndex;

    @Schema(description = "차입 인덱스")
    private BigInteger borrowIndex;

    @Schema(description = "현재 가격")
    private BigInteger price;

    @Schema(description = "투영 기준 시각 (epoch seconds)")
    private Long asOf;
}
