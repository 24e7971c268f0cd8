package dustin.lending.domains.market.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.lending.domains.market.model.entity.Market;
import jakarta.persistence.LockModeType;

/**
 * 마켓 리포지토리
 * Market Repository
 *
 * 역할:
 * - 마켓 CRUD
 * - 비관적 락으로 이자 누적(인덱스 갱신) 직렬화
 */
@Repository
public interface MarketRepository extends JpaRepository<Market, Long> {

    /**
     * 자산으로 마켓 조회 (비관적 락)
     *
     * @param asset 자산 식별자
     * @return 마켓 (없으면 Optional.empty())
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Market m WHERE m.asset = :asset")
    Optional<Market> findByAssetForUpdate(@Param("asset") String asset);

    Optional<Market> findByAsset(String asset);

    boolean existsByAsset(String asset);

    List<Market> findByAssetIn(Collection<String> assets);

    List<Market> findByActiveTrueOrderByAssetAsc();

    List<Market> findAllByOrderByAssetAsc();
}
