package dustin.lending.domains.wallet.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 수량 요청 DTO
 * Amount Request DTO
 *
 * 공급/출금/차입/상환/발행 요청에 공통으로 사용합니다.
 * 0 이하 수량은 서비스에서 INVALID_AMOUNT로 거부됩니다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "수량 요청")
public class AmountRequest {

    @NotNull(message = "수량은 필수입니다")
    @Schema(description = "수량 (자산 최소 단위 정수)", example = "1000000000000000000000", required = true)
    private BigInteger amount;
}
