package dustin.lending.shared.exception;

import org.springframework.http.HttpStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 원장 오류 코드
 * Ledger Error Codes
 *
 * 모든 오류는 작업 전체를 동기적으로 거부하며, 부분 반영은 없습니다.
 */
@Getter
@AllArgsConstructor
public enum LedgerErrorCode {

    // 요청 값 오류 1000+
    INVALID_AMOUNT(1001, HttpStatus.BAD_REQUEST, "Amount must be greater than zero"),
    INVALID_PRICE(1002, HttpStatus.BAD_REQUEST, "Price must be greater than zero"),
    INVALID_USER(1003, HttpStatus.BAD_REQUEST, "User id must be a positive number"),

    // 마켓 오류 1100+
    ASSET_NOT_ACTIVE(1101, HttpStatus.BAD_REQUEST, "Asset is not listed or not active"),
    ASSET_ALREADY_REGISTERED(1102, HttpStatus.CONFLICT, "Asset is already registered"),
    INVALID_RISK_PARAMETERS(1103, HttpStatus.BAD_REQUEST, "Invalid risk parameters"),

    // 잔고/담보 오류 1200+
    INSUFFICIENT_BALANCE(1201, HttpStatus.BAD_REQUEST, "Insufficient balance"),
    INSUFFICIENT_COLLATERAL(1202, HttpStatus.BAD_REQUEST, "Insufficient collateral"),
    NO_COLLATERAL_OR_NO_DEBT(1203, HttpStatus.BAD_REQUEST, "No collateral or no debt for this asset"),

    // 청산 오류 1300+
    SELF_LIQUIDATION_DISALLOWED(1301, HttpStatus.BAD_REQUEST, "Cannot liquidate own position"),
    NOT_LIQUIDATABLE(1302, HttpStatus.BAD_REQUEST, "Position is not liquidatable"),
    SEIZE_EXCEEDS_COLLATERAL(1303, HttpStatus.BAD_REQUEST, "Seize amount exceeds available collateral"),

    // 이체/운영 오류 1400+
    TRANSFER_FAILED(1401, HttpStatus.BAD_REQUEST, "Asset transfer failed"),
    PROTOCOL_PAUSED(1402, HttpStatus.SERVICE_UNAVAILABLE, "Protocol is paused"),
    CONCURRENT_UPDATE(1403, HttpStatus.CONFLICT, "Concurrent update, please retry");

    private final int code;
    private final HttpStatus status;
    private final String message;
}
