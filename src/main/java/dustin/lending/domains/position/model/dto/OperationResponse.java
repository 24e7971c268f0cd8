package dustin.lending.domains.position.model.dto;

import java.math.BigInteger;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "원장 작업 결과")
public class OperationResponse {

    @Schema(description = "작업 종류", example = "REPAY")
    private String operation;

    @Schema(description = "요청 수량")
    private BigInteger requestedAmount;

    /**
     * 실제 처리 수량 (상환은 부채 이하로 절삭됨)
     */
    @Schema(description = "실제 처리 수량")
    private BigInteger amount;

    @Schema(description = "작업 후 포지션")
    private PositionResponse position;
}
