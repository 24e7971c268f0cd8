package dustin.lending.domains.liquidation.controller;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.lending.domains.liquidation.model.dto.LiquidateRequest;
import dustin.lending.domains.liquidation.model.dto.LiquidationResponse;
import dustin.lending.domains.liquidation.service.LiquidationEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 청산 컨트롤러
 * Liquidation Controller
 *
 * API 엔드포인트:
 * - POST /api/ledger/liquidations - 청산 실행
 * - GET /api/ledger/liquidations?borrowerId= - 청산 이력 조회
 */
@RestController
@RequestMapping("/api/ledger/liquidations")
@RequiredArgsConstructor
@Tag(name = "Liquidations", description = "청산 API 엔드포인트")
public class LiquidationController {

    private final LiquidationEngine liquidationEngine;

    @Operation(summary = "청산", description = "헬스 팩터 1.0 미만 계정의 부채를 대신 상환하고 보너스를 포함한 담보를 받습니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "청산 성공"),
            @ApiResponse(responseCode = "400", description = "청산 불가 (건전한 계정, 자기 청산, 담보 부족 등)")
    })
    @PostMapping
    public ResponseEntity<LiquidationResponse> liquidate(
            @Valid @RequestBody LiquidateRequest request,
            @RequestHeader("X-User-Id") Long liquidatorId
    ) {
        return ResponseEntity.ok(LiquidationResponse.from(liquidationEngine.liquidate(
                liquidatorId,
                request.getBorrowerId(),
                request.getBorrowAsset(),
                request.getCollateralAsset(),
                request.getRepayAmount())));
    }

    @Operation(summary = "청산 이력 조회", description = "borrowerId가 없으면 최근 100건을 조회합니다.")
    @GetMapping
    public ResponseEntity<List<LiquidationResponse>> getHistory(
            @RequestParam(required = false) Long borrowerId
    ) {
        return ResponseEntity.ok(liquidationEngine.getHistory(borrowerId).stream()
                .map(LiquidationResponse::from)
                .collect(Collectors.toList()));
    }
}
