package dustin.lending.domains.protocol.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "일시 정지 요청")
public class PauseRequest {

    @NotNull(message = "paused 값은 필수입니다")
    @Schema(description = "일시 정지 여부", example = "true", required = true)
    private Boolean paused;
}
