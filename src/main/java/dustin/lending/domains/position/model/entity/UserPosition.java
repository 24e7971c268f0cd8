package dustin.lending.domains.position.model.entity;

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
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용자 포지션 엔티티
 * User Position Entity
 *
 * 역할:
 * - 사용자별, 자산별 공급 원금 / 차입 원금 저장
 * - 마지막으로 건드린 시점의 마켓 인덱스 스냅샷 저장
 *
 * 잔고 재구성:
 * ============
 * 현재 잔고 = 원금 × 현재 인덱스 / 스냅샷 인덱스 (내림)
 * 원금은 포지션을 건드릴 때마다 현재 잔고로 다시 쓰이고 스냅샷이 갱신됩니다.
 *
 * 사용자가 한 번이라도 공급/차입한 자산마다 행이 하나 생기며 삭제되지 않습니다.
 * 사용자의 포지션 행 집합이 곧 지급능력 평가 대상 자산 집합입니다.
 */
@Entity
@Table(name = "user_positions",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "asset"}),
       indexes = {
           @Index(name = "idx_user_positions_user_id", columnList = "user_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPosition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "asset", nullable = false, length = 50)
    private String asset;

    /**
     * 공급 원금 (supplyIndexSnapshot 기준)
     */
    @Column(name = "supplied_amount", nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger suppliedAmount = BigInteger.ZERO;

    /**
     * 차입 원금 (borrowIndexSnapshot 기준)
     */
    @Column(name = "borrowed_amount", nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger borrowedAmount = BigInteger.ZERO;

    @Column(name = "supply_index_snapshot", nullable = false, precision = 78, scale = 0)
    private BigInteger supplyIndexSnapshot;

    @Column(name = "borrow_index_snapshot", nullable = false, precision = 78, scale = 0)
    private BigInteger borrowIndexSnapshot;

    /**
     * 담보 사용 여부
     */
    @Column(name = "collateral", nullable = false)
    @Builder.Default
    private Boolean collateral = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isCollateralEnabled() {
        return Boolean.TRUE.equals(collateral);
    }

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
