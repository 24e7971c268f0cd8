package dustin.lending.domains.wallet.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 지갑 잔고 응답 DTO
 * Wallet Balance Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "지갑 잔고 정보")
public class WalletBalanceResponse {

    @Schema(description = "사용자 ID", example = "1")
    private Long userId;

    @Schema(description = "자산 식별자", example = "USDC")
    private String asset;

    @Schema(description = "사용 가능 잔고 (최소 단위)", example = "1000000000000000000000")
    private BigInteger available;
}
