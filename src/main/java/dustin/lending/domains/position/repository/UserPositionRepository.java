package dustin.lending.domains.position.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.lending.domains.position.model.entity.UserPosition;
import jakarta.persistence.LockModeType;

/**
 * 사용자 포지션 리포지토리
 * User Position Repository
 *
 * 역할:
 * - 포지션 CRUD 작업
 * - 비관적 락을 사용한 동시성 제어
 * - 사용자의 평가 대상 자산 집합 조회 (생성 순)
 */
@Repository
public interface UserPositionRepository extends JpaRepository<UserPosition, Long> {

    /**
     * 사용자 ID와 자산으로 포지션 조회 (비관적 락)
     *
     * @param userId 사용자 ID
     * @param asset 자산
     * @return 포지션 (없으면 Optional.empty())
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM UserPosition p WHERE p.userId = :userId AND p.asset = :asset")
    Optional<UserPosition> findByUserIdAndAssetForUpdate(
        @Param("userId") Long userId,
        @Param("asset") String asset
    );

    Optional<UserPosition> findByUserIdAndAsset(Long userId, String asset);

    /**
     * 사용자의 모든 포지션 (생성 순)
     */
    List<UserPosition> findByUserIdOrderByIdAsc(Long userId);
}
