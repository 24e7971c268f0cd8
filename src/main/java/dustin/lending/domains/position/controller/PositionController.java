package dustin.lending.domains.position.controller;

import java.math.BigInteger;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.lending.domains.position.model.dto.CollateralRequest;
import dustin.lending.domains.position.model.dto.OperationResponse;
import dustin.lending.domains.position.model.dto.PositionResponse;
import dustin.lending.domains.position.service.LendingService;
import dustin.lending.domains.position.service.PositionQueryService;
import dustin.lending.domains.wallet.model.dto.AmountRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 포지션 컨트롤러
 * Position Controller
 *
 * API 엔드포인트:
 * - POST /api/ledger/positions/{asset}/supply - 공급
 * - POST /api/ledger/positions/{asset}/withdraw - 출금
 * - POST /api/ledger/positions/{asset}/borrow - 차입
 * - POST /api/ledger/positions/{asset}/repay - 상환
 * - PUT /api/ledger/positions/{asset}/collateral - 담보 사용 설정
 * - GET /api/ledger/positions - 내 포지션 목록
 * - GET /api/ledger/positions/{asset} - 자산별 포지션
 *
 * 호출자는 X-User-Id 헤더로 식별합니다.
 */
@RestController
@RequestMapping("/api/ledger/positions")
@RequiredArgsConstructor
@Tag(name = "Positions", description = "공급/차입 포지션 API 엔드포인트")
public class PositionController {

    private final LendingService lendingService;
    private final PositionQueryService positionQueryService;

    @Operation(summary = "공급", description = "지갑의 자산을 프로토콜에 공급합니다. 담보 사용은 별도로 설정해야 합니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "공급 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 수량, 비활성 자산, 지갑 잔고 부족"),
            @ApiResponse(responseCode = "503", description = "프로토콜 일시 정지")
    })
    @PostMapping("/{asset}/supply")
    public ResponseEntity<OperationResponse> supply(
            @Parameter(description = "자산 식별자", example = "ETH") @PathVariable String asset,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        lendingService.supply(userId, asset, request.getAmount());
        return ResponseEntity.ok(result("SUPPLY", userId, asset, request.getAmount(), request.getAmount()));
    }

    @Operation(summary = "출금", description = "공급한 자산을 출금합니다. 담보 자산은 출금 후에도 부채를 감당할 수 있어야 합니다.")
    @PostMapping("/{asset}/withdraw")
    public ResponseEntity<OperationResponse> withdraw(
            @PathVariable String asset,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        lendingService.withdraw(userId, asset, request.getAmount());
        return ResponseEntity.ok(result("WITHDRAW", userId, asset, request.getAmount(), request.getAmount()));
    }

    @Operation(summary = "차입", description = "담보 인정 가치 한도 내에서 자산을 차입합니다.")
    @PostMapping("/{asset}/borrow")
    public ResponseEntity<OperationResponse> borrow(
            @PathVariable String asset,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        lendingService.borrow(userId, asset, request.getAmount());
        return ResponseEntity.ok(result("BORROW", userId, asset, request.getAmount(), request.getAmount()));
    }

    @Operation(summary = "상환", description = "부채를 상환합니다. 부채보다 많이 요청하면 부채만큼만 상환됩니다.")
    @PostMapping("/{asset}/repay")
    public ResponseEntity<OperationResponse> repay(
            @PathVariable String asset,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        BigInteger repaid = lendingService.repay(userId, asset, request.getAmount());
        return ResponseEntity.ok(result("REPAY", userId, asset, request.getAmount(), repaid));
    }

    @Operation(summary = "담보 사용 설정")
    @PutMapping("/{asset}/collateral")
    public ResponseEntity<PositionResponse> setCollateral(
            @PathVariable String asset,
            @Valid @RequestBody CollateralRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        lendingService.setCollateral(userId, asset, request.getEnabled());
        return ResponseEntity.ok(positionQueryService.getPosition(userId, asset));
    }

    @Operation(summary = "내 포지션 목록", description = "이자를 반영한 현재 잔고를 조회합니다.")
    @GetMapping
    public ResponseEntity<List<PositionResponse>> getPositions(@RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(positionQueryService.getPositions(userId));
    }

    @Operation(summary = "자산별 포지션 조회")
    @GetMapping("/{asset}")
    public ResponseEntity<PositionResponse> getPosition(
            @PathVariable String asset,
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(positionQueryService.getPosition(userId, asset));
    }

    private OperationResponse result(String operation, Long userId, String asset,
                                     BigInteger requested, BigInteger actual) {
        return OperationResponse.builder()
                .operation(operation)
                .requestedAmount(requested)
                .amount(actual)
                .position(positionQueryService.getPosition(userId, asset))
                .build();
    }
}
