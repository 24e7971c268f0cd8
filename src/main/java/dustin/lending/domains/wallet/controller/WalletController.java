package dustin.lending.domains.wallet.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.lending.domains.wallet.model.dto.AmountRequest;
import dustin.lending.domains.wallet.model.dto.WalletBalanceResponse;
import dustin.lending.domains.wallet.service.WalletService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 지갑 컨트롤러
 * Wallet Controller
 *
 * API 엔드포인트:
 * - GET /api/ledger/wallets - 내 지갑 잔고 조회
 * - POST /api/ledger/wallets/{asset}/mint - 테스트 자산 발행
 */
@RestController
@RequestMapping("/api/ledger/wallets")
@RequiredArgsConstructor
@Tag(name = "Wallets", description = "지갑 API 엔드포인트")
public class WalletController {

    private final WalletService walletService;

    @Operation(summary = "지갑 잔고 조회", description = "프로토콜 밖에 있는 사용자 지갑의 자산별 잔고를 조회합니다.")
    @GetMapping
    public ResponseEntity<List<WalletBalanceResponse>> getBalances(
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(walletService.getBalances(userId));
    }

    @Operation(summary = "테스트 자산 발행", description = "테스트넷 전용. 등록된 자산을 사용자 지갑에 발행합니다.")
    @PostMapping("/{asset}/mint")
    public ResponseEntity<WalletBalanceResponse> mint(
            @PathVariable String asset,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(walletService.mint(userId, asset, request.getAmount()));
    }
}
