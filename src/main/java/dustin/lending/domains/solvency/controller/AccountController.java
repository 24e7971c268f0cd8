package dustin.lending.domains.solvency.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.lending.domains.solvency.model.dto.AccountLiquidityResponse;
import dustin.lending.domains.solvency.service.SolvencyEvaluator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 계정 컨트롤러
 * Account Controller
 *
 * API 엔드포인트:
 * - GET /api/ledger/accounts/liquidity - 계정 유동성 조회
 */
@RestController
@RequestMapping("/api/ledger/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "계정 지급능력 API 엔드포인트")
public class AccountController {

    private final SolvencyEvaluator solvencyEvaluator;

    @Operation(summary = "계정 유동성 조회", description = "담보 가치, 부채 가치, 헬스 팩터를 조회합니다. 상태를 변경하지 않습니다.")
    @GetMapping("/liquidity")
    public ResponseEntity<AccountLiquidityResponse> getLiquidity(
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(AccountLiquidityResponse.from(userId, solvencyEvaluator.evaluate(userId)));
    }
}
