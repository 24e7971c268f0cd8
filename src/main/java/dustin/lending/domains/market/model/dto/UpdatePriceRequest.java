package dustin.lending.domains.market.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "가격 갱신 요청")
public class UpdatePriceRequest {

    @NotNull(message = "가격은 필수입니다")
    @Schema(description = "새 가격 (1e18 = 기준 통화 1단위)", example = "2000000000000000000000", required = true)
    private BigInteger price;
}
