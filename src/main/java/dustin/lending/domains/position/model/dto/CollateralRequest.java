package dustin.lending.domains.position.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "담보 설정 요청")
public class CollateralRequest {

    @NotNull(message = "enabled는 필수입니다")
    @Schema(description = "담보 사용 여부", example = "true", required = true)
    private Boolean enabled;
}
