package dustin.lending.domains.wallet.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.lending.domains.wallet.model.entity.WalletBalance;
import jakarta.persistence.LockModeType;

/**
 * 지갑 잔고 리포지토리
 * Wallet Balance Repository
 *
 * 역할:
 * - 지갑 잔고 CRUD 작업
 * - 비관적 락을 사용한 동시성 제어
 */
@Repository
public interface WalletBalanceRepository extends JpaRepository<WalletBalance, Long> {

    /**
     * 사용자 ID와 자산으로 잔고 조회 (비관적 락)
     *
     * @param userId 사용자 ID
     * @param asset 자산 식별자
     * @return 잔고 (없으면 Optional.empty())
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WalletBalance w WHERE w.userId = :userId AND w.asset = :asset")
    Optional<WalletBalance> findByUserIdAndAssetForUpdate(
        @Param("userId") Long userId,
        @Param("asset") String asset
    );

    Optional<WalletBalance> findByUserIdAndAsset(Long userId, String asset);

    List<WalletBalance> findByUserIdOrderByAssetAsc(Long userId);
}
