package dustin.lending.domains.position.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.lending.domains.position.model.entity.LedgerAccount;
import jakarta.persistence.LockModeType;

@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, Long> {

    /**
     * 원장 계정 조회 (비관적 락)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM LedgerAccount a WHERE a.userId = :userId")
    Optional<LedgerAccount> findByUserIdForUpdate(@Param("userId") Long userId);
}
