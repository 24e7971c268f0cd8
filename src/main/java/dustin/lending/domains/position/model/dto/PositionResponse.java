package dustin.lending.domains.position.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 포지션 응답 DTO
 * Position Response DTO
 *
 * 잔고는 조회 시점까지 이자를 반영한 값입니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "사용자 포지션")
public class PositionResponse {

    @Schema(description = "사용자 ID", example = "1")
    private Long userId;

    @Schema(description = "자산", example = "ETH")
    private String asset;

    @Schema(description = "현재 공급 잔고 (이자 포함)")
    private BigInteger supplyBalance;

    @Schema(description = "현재 차입 잔고 (이자 포함)")
    private BigInteger borrowBalance;

    @Schema(description = "담보 사용 여부")
    private Boolean collateral;

    public static PositionResponse empty(Long userId, String asset) {
        return PositionResponse.builder()
                .userId(userId)
                .asset(asset)
                .supplyBalance(BigInteger.ZERO)
                .borrowBalance(BigInteger.ZERO)
                .collateral(false)
                .build();
    }
}
