package dustin.lending.shared.exception;

import java.util.HashMap;
import java.util.Map;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleLedgerException(LedgerException e) {
        LedgerErrorCode errorCode = e.getErrorCode();
        log.warn("[GlobalExceptionHandler] 요청 거부: code={}, message={}", errorCode, e.getMessage());
        return ResponseEntity.status(errorCode.getStatus()).body(body(errorCode.name(), errorCode.getCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(body("INVALID_REQUEST", HttpStatus.BAD_REQUEST.value(), message));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(body("MISSING_USER", HttpStatus.UNAUTHORIZED.value(), e.getMessage()));
    }

    /**
     * 계정 행 동시 생성, 락 획득 실패 등 재시도하면 성공할 수 있는 충돌
     */
    @ExceptionHandler({DataIntegrityViolationException.class, PessimisticLockingFailureException.class})
    public ResponseEntity<Map<String, Object>> handleConcurrency(RuntimeException e) {
        log.warn("[GlobalExceptionHandler] 동시성 충돌: {}", e.getMessage());
        LedgerErrorCode errorCode = LedgerErrorCode.CONCURRENT_UPDATE;
        return ResponseEntity.status(errorCode.getStatus())
                .body(body(errorCode.name(), errorCode.getCode(), errorCode.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("[GlobalExceptionHandler] 처리되지 않은 예외", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR.value(), "Internal server error"));
    }

    private Map<String, Object> body(String error, int code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("code", code);
        body.put("message", message);
        return body;
    }
}
