package dustin.lending.domains.protocol.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.lending.domains.protocol.model.dto.PauseRequest;
import dustin.lending.domains.protocol.service.ProtocolStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 프로토콜 관리 컨트롤러
 * Protocol Admin Controller
 *
 * API 엔드포인트:
 * - GET /api/ledger/admin/pause - 일시 정지 상태 조회
 * - POST /api/ledger/admin/pause - 일시 정지 토글
 */
@RestController
@RequestMapping("/api/ledger/admin/pause")
@RequiredArgsConstructor
@Tag(name = "Protocol Admin", description = "프로토콜 관리 API")
public class ProtocolAdminController {

    private final ProtocolStatusService protocolStatusService;

    @Operation(summary = "일시 정지 상태 조회")
    @GetMapping
    public ResponseEntity<Map<String, Boolean>> getPaused() {
        return ResponseEntity.ok(Map.of("paused", protocolStatusService.isPaused()));
    }

    @Operation(summary = "일시 정지 설정", description = "일시 정지 중에는 공급/출금/차입/상환/담보 설정/청산이 거부됩니다.")
    @PostMapping
    public ResponseEntity<Map<String, Boolean>> setPaused(@Valid @RequestBody PauseRequest request) {
        boolean paused = protocolStatusService.setPaused(request.getPaused());
        return ResponseEntity.ok(Map.of("paused", paused));
    }
}
