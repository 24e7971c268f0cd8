package dustin.lending.domains.market.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.lending.domains.market.model.dto.MarketResponse;
import dustin.lending.domains.market.model.dto.RegisterMarketRequest;
import dustin.lending.domains.market.model.dto.UpdatePriceRequest;
import dustin.lending.domains.market.service.InterestAccrualService;
import dustin.lending.domains.market.service.MarketAdminService;
import dustin.lending.domains.market.service.MarketQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 마켓 컨트롤러
 * Market Controller
 *
 * API 엔드포인트:
 * - POST /api/ledger/markets - 마켓 등록 (관리자)
 * - PUT /api/ledger/markets/{asset}/price - 가격 갱신 (관리자)
 * - POST /api/ledger/markets/{asset}/accrue - 이자 누적 (키퍼)
 * - GET /api/ledger/markets - 전체 마켓 조회
 * - GET /api/ledger/markets/{asset} - 마켓 이용률 요약 조회
 */
@RestController
@RequestMapping("/api/ledger/markets")
@RequiredArgsConstructor
@Tag(name = "Markets", description = "마켓 관리 및 조회 API 엔드포인트")
public class MarketController {

    private final MarketAdminService marketAdminService;
    private final MarketQueryService marketQueryService;
    private final InterestAccrualService interestAccrualService;

    @Operation(summary = "마켓 등록", description = "새 자산 마켓을 등록합니다. 연이율은 초당 이율로 환산되어 고정됩니다.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "등록 성공"),
            @ApiResponse(responseCode = "400", description = "리스크 파라미터 오류"),
            @ApiResponse(responseCode = "409", description = "이미 등록된 자산")
    })
    @PostMapping
    public ResponseEntity<MarketResponse> registerMarket(@Valid @RequestBody RegisterMarketRequest request) {
        marketAdminService.registerMarket(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(marketQueryService.getMarket(request.getAsset()));
    }

    @Operation(summary = "가격 갱신", description = "오라클 가격을 갱신합니다. 0 이하 가격은 거부됩니다.")
    @PutMapping("/{asset}/price")
    public ResponseEntity<MarketResponse> updatePrice(
            @Parameter(description = "자산 식별자", example = "ETH") @PathVariable String asset,
            @Valid @RequestBody UpdatePriceRequest request
    ) {
        marketAdminService.updatePrice(asset, request.getPrice());
        return ResponseEntity.ok(marketQueryService.getMarket(asset));
    }

    @Operation(summary = "이자 누적", description = "마켓 인덱스를 현재 시각까지 진행합니다. 누구나 호출할 수 있습니다.")
    @PostMapping("/{asset}/accrue")
    public ResponseEntity<MarketResponse> accrue(@PathVariable String asset) {
        interestAccrualService.accrueMarket(asset);
        return ResponseEntity.ok(marketQueryService.getMarket(asset));
    }

    @Operation(summary = "전체 마켓 조회")
    @GetMapping
    public ResponseEntity<List<MarketResponse>> getMarkets() {
        return ResponseEntity.ok(marketQueryService.getAllMarkets());
    }

    @Operation(summary = "마켓 조회", description = "총량, 이용률, 이율, 인덱스, 가격, 리스크 파라미터를 조회합니다.")
    @GetMapping("/{asset}")
    public ResponseEntity<MarketResponse> getMarket(@PathVariable String asset) {
        return ResponseEntity.ok(marketQueryService.getMarket(asset));
    }
}
