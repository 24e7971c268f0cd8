package dustin.lending.domains.market.model.entity;

import java.math.BigInteger;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 엔티티 (자산별 원장)
 * Market Entity
 *
 * 역할:
 * - 자산별 공급/차입 총량, 이율, 리스크 파라미터, 이자 인덱스 관리
 * - 자산당 하나, 관리자 등록 후 삭제되지 않음
 *
 * 고정소수점:
 * - 모든 비율/인덱스/가격은 1e18 = 1.0
 * - 수량은 자산의 최소 단위 정수
 *
 * 불변식:
 * - supplyIndex, borrowIndex는 절대 감소하지 않음
 * - collateralFactor < liquidationThreshold <= 1e18
 */
@Entity
@Table(name = "markets",
       indexes = @Index(name = "idx_markets_active", columnList = "active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Market {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 자산 식별자 (예: USDC, WETH)
     */
    @Column(name = "asset", nullable = false, unique = true, length = 50)
    private String asset;

    /**
     * 활성화 여부 (등록 시 true, 코어에서 해제하지 않음)
     */
    @Column(name = "active", nullable = false)
    private Boolean active;

    /**
     * 총 공급량 (누적 이자 포함)
     */
    @Column(name = "total_supplied", nullable = false, precision = 78, scale = 0)
    private BigInteger totalSupplied;

    /**
     * 총 차입량 (누적 이자 포함)
     */
    @Column(name = "total_borrowed", nullable = false, precision = 78, scale = 0)
    private BigInteger totalBorrowed;

    /**
     * 초당 공급 이율 (연이율 / 1년 초 수, 내림)
     */
    @Column(name = "supply_rate_per_second", nullable = false, precision = 78, scale = 0)
    private BigInteger supplyRatePerSecond;

    /**
     * 초당 차입 이율
     */
    @Column(name = "borrow_rate_per_second", nullable = false, precision = 78, scale = 0)
    private BigInteger borrowRatePerSecond;

    @Column(name = "reserve_factor", nullable = false, precision = 78, scale = 0)
    private BigInteger reserveFactor;

    /**
     * 담보 인정 비율 (차입 한도 계산용)
     */
    @Column(name = "collateral_factor", nullable = false, precision = 78, scale = 0)
    private BigInteger collateralFactor;

    /**
     * 청산 임계값 (헬스 팩터 계산용)
     */
    @Column(name = "liquidation_threshold", nullable = false, precision = 78, scale = 0)
    private BigInteger liquidationThreshold;

    /**
     * 마지막 이자 누적 시각 (epoch seconds)
     */
    @Column(name = "last_update_time", nullable = false)
    private Long lastUpdateTime;

    @Column(name = "supply_index", nullable = false, precision = 78, scale = 0)
    private BigInteger supplyIndex;

    @Column(name = "borrow_index", nullable = false, precision = 78, scale = 0)
    private BigInteger borrowIndex;

    /**
     * 오라클 가격 (1e18 = 기준 통화 1단위)
     */
    @Column(name = "price", nullable = false, precision = 78, scale = 0)
    private BigInteger price;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
