package dustin.lending.domains.liquidation.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.lending.domains.liquidation.model.entity.LiquidationRecord;

/**
 * 청산 이력 리포지토리
 * Liquidation Record Repository
 */
@Repository
public interface LiquidationRecordRepository extends JpaRepository<LiquidationRecord, Long> {

    List<LiquidationRecord> findByBorrowerIdOrderByIdDesc(Long borrowerId);

    List<LiquidationRecord> findTop100ByOrderByIdDesc();
}
