package dustin.lending.domains.liquidation.model.entity;

import java.math.BigInteger;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 청산 이력 엔티티
 * Liquidation Record Entity
 *
 * 청산 1건당 1행. 실행 시점의 가격과 청산 전 헬스 팩터를 함께 기록합니다.
 * 생성 후 변경되지 않습니다.
 */
@Entity
@Table(name = "liquidation_records", indexes = {
    @Index(name = "idx_liquidation_records_borrower_id", columnList = "borrower_id"),
    @Index(name = "idx_liquidation_records_liquidator_id", columnList = "liquidator_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "liquidator_id", nullable = false)
    private Long liquidatorId;

    @Column(name = "borrower_id", nullable = false)
    private Long borrowerId;

    @Column(name = "borrow_asset", nullable = false, length = 50)
    private String borrowAsset;

    @Column(name = "collateral_asset", nullable = false, length = 50)
    private String collateralAsset;

    @Column(name = "requested_repay_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger requestedRepayAmount;

    /**
     * 실제 상환 수량 (close factor 한도로 절삭)
     */
    @Column(name = "repay_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger repayAmount;

    /**
     * 압류 담보 수량 (청산 보너스 포함)
     */
    @Column(name = "seize_amount", nullable = false, precision = 78, scale = 0)
    private BigInteger seizeAmount;

    @Column(name = "borrow_asset_price", nullable = false, precision = 78, scale = 0)
    private BigInteger borrowAssetPrice;

    @Column(name = "collateral_asset_price", nullable = false, precision = 78, scale = 0)
    private BigInteger collateralAssetPrice;

    @Column(name = "health_factor_before", nullable = false, precision = 78, scale = 0)
    private BigInteger healthFactorBefore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
