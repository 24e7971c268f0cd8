package dustin.lending.domains.position.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import dustin.lending.domains.position.model.entity.LedgerAccount;
import dustin.lending.domains.position.repository.LedgerAccountRepository;
import dustin.lending.shared.exception.LedgerErrorCode;
import dustin.lending.shared.exception.LedgerException;
import lombok.RequiredArgsConstructor;

/**
 * 원장 계정 락 서비스
 * Account Lock Service
 *
 * 사용자별 변경 작업을 직렬화합니다. 락은 커밋/롤백 시 해제됩니다.
 */
@Service
@RequiredArgsConstructor
public class AccountLockService {

    private final LedgerAccountRepository ledgerAccountRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerAccount lock(Long userId) {
        if (userId == null || userId <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_USER, String.valueOf(userId));
        }

        LedgerAccount account = ledgerAccountRepository.findByUserIdForUpdate(userId)
                .orElseGet(() -> ledgerAccountRepository.saveAndFlush(LedgerAccount.builder()
                        .userId(userId)
                        .build()));
        account.setLastOperationAt(LocalDateTime.now(clock));
        return account;
    }
}
