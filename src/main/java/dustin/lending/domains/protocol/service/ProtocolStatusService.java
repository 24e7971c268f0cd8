package dustin.lending.domains.protocol.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.protocol.model.entity.ProtocolStatus;
import dustin.lending.domains.protocol.repository.ProtocolStatusRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import dustin.lending.shared.kafka.model.LedgerEvent;
import dustin.lending.shared.kafka.model.LedgerEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로토콜 상태 서비스
 * Protocol Status Service
 *
 * 역할:
 * - 전역 일시 정지 토글 (관리자)
 * - 사용자 변경 작업 전 일시 정지 여부 확인
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProtocolStatusService {

    private final ProtocolStatusRepository protocolStatusRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean isPaused() {
        return protocolStatusRepository.findById(ProtocolStatus.SINGLETON_ID)
                .map(status -> Boolean.TRUE.equals(status.getPaused()))
                .orElse(false);
    }

    /**
     * 일시 정지 상태면 PROTOCOL_PAUSED
     */
    @Transactional(readOnly = true)
    public void assertNotPaused() {
        if (isPaused()) {
            throw new LedgerException(LedgerErrorCode.PROTOCOL_PAUSED);
        }
    }

    @Transactional
    public boolean setPaused(boolean paused) {
        ProtocolStatus status = protocolStatusRepository.findById(ProtocolStatus.SINGLETON_ID)
                .orElseGet(() -> ProtocolStatus.builder()
                        .id(ProtocolStatus.SINGLETON_ID)
                        .paused(false)
                        .build());
        status.setPaused(paused);
        protocolStatusRepository.save(status);

        log.info("[ProtocolStatusService] 프로토콜 일시 정지 변경: paused={}", paused);
        eventPublisher.publishEvent(LedgerEvent.builder()
                .eventType(LedgerEventType.PROTOCOL_PAUSE_CHANGED)
                .flag(paused)
                .timestamp(LocalDateTime.now(clock))
                .build());
        return paused;
    }
}
