package dustin.lending.domains.position.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import dustin.lending.support.LedgerIntegrationTestSupport;

/**
 * REST API 및 오류 응답 매핑 테스트
 *
 * 오류 응답 형식: {"error": 코드 이름, "code": 숫자 코드, "message": 설명}
 */
@AutoConfigureMockMvc
class LedgerApiTest extends LedgerIntegrationTestSupport {

    private static final String ETH_MARKET = """
            {"asset":"ETH","annualSupplyRate":0,"annualBorrowRate":0,"reserveFactor":0,
             "collateralFactor":800000000000000000,"liquidationThreshold":850000000000000000,
             "initialPrice":2000000000000000000000}
            """;

    private static final String USDC_MARKET = """
            {"asset":"USDC","annualSupplyRate":0,"annualBorrowRate":0,"reserveFactor":0,
             "collateralFactor":800000000000000000,"liquidationThreshold":850000000000000000,
             "initialPrice":1000000000000000000}
            """;

    private static final String ONE_UNIT = "{\"amount\":1000000000000000000}";

    @Autowired
    private MockMvc mockMvc;

    @BeforeEach
    void registerMarkets() throws Exception {
        mockMvc.perform(post("/api/ledger/markets").contentType(MediaType.APPLICATION_JSON).content(ETH_MARKET))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.asset").value("ETH"))
                .andExpect(jsonPath("$.active").value(true));
        mockMvc.perform(post("/api/ledger/markets").contentType(MediaType.APPLICATION_JSON).content(USDC_MARKET))
                .andExpect(status().isCreated());
    }

    @Test
    @DisplayName("중복 등록은 409 ASSET_ALREADY_REGISTERED")
    void duplicateMarket() throws Exception {
        mockMvc.perform(post("/api/ledger/markets").contentType(MediaType.APPLICATION_JSON).content(ETH_MARKET))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ASSET_ALREADY_REGISTERED"))
                .andExpect(jsonPath("$.code").value(1102));
    }

    @Test
    @DisplayName("X-User-Id 헤더가 없으면 401")
    void missingUserHeader() throws Exception {
        mockMvc.perform(post("/api/ledger/positions/ETH/supply")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_UNIT))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("MISSING_USER"));
    }

    @Test
    @DisplayName("수량 누락은 400 INVALID_REQUEST, 0 수량은 400 INVALID_AMOUNT")
    void invalidAmounts() throws Exception {
        mockMvc.perform(post("/api/ledger/positions/ETH/supply")
                        .header("X-User-Id", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        mockMvc.perform(post("/api/ledger/positions/ETH/supply")
                        .header("X-User-Id", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_AMOUNT"))
                .andExpect(jsonPath("$.code").value(1001));
    }

    @Test
    @DisplayName("일시 정지 중 공급은 503 PROTOCOL_PAUSED")
    void pausedProtocol() throws Exception {
        mockMvc.perform(post("/api/ledger/admin/pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paused\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paused").value(true));

        mockMvc.perform(post("/api/ledger/positions/ETH/supply")
                        .header("X-User-Id", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_UNIT))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("PROTOCOL_PAUSED"));
    }

    @Test
    @DisplayName("발행 → 공급 → 담보 설정 → 유동성 조회 → 건전한 계정 청산 거부")
    void endToEndFlow() throws Exception {
        mockMvc.perform(post("/api/ledger/wallets/ETH/mint")
                        .header("X-User-Id", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_UNIT))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/ledger/positions/ETH/supply")
                        .header("X-User-Id", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ONE_UNIT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operation").value("SUPPLY"))
                .andExpect(jsonPath("$.position.asset").value("ETH"))
                .andExpect(jsonPath("$.position.collateral").value(false));

        mockMvc.perform(put("/api/ledger/positions/ETH/collateral")
                        .header("X-User-Id", 1)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"enabled\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collateral").value(true));

        mockMvc.perform(get("/api/ledger/positions").header("X-User-Id", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(get("/api/ledger/accounts/liquidity").header("X-User-Id", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userId").value(1))
                .andExpect(jsonPath("$.liquidatable").value(false));

        mockMvc.perform(post("/api/ledger/liquidations")
                        .header("X-User-Id", 3)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"borrowerId\":1,\"borrowAsset\":\"USDC\",\"collateralAsset\":\"ETH\",\"repayAmount\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("NOT_LIQUIDATABLE"));

        mockMvc.perform(get("/api/ledger/liquidations").param("borrowerId", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    @DisplayName("등록되지 않은 마켓 조회는 400 ASSET_NOT_ACTIVE")
    void unknownMarket() throws Exception {
        mockMvc.perform(get("/api/ledger/markets/DOGE"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ASSET_NOT_ACTIVE"));

        mockMvc.perform(get("/api/ledger/markets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }
}
