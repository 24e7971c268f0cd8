package dustin.lending.domains.wallet.model.entity;

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
 * 지갑 잔고 엔티티
 * Wallet Balance Entity
 *
 * 역할:
 * - 사용자 외부 지갑의 자산별 잔고 (프로토콜 밖의 자금)
 * - 프로토콜 보관(custody) 잔고는 userId = 0 으로 관리
 *
 * 자금 이동:
 * - 공급/상환/청산 상환: 사용자 지갑 → custody (pull)
 * - 출금/차입/압류 담보 지급: custody → 사용자 지갑 (push)
 */
@Entity
@Table(name = "wallet_balances",
       uniqueConstraints = @UniqueConstraint(columnNames = {"user_id", "asset"}),
       indexes = {
           @Index(name = "idx_wallet_balances_user_id", columnList = "user_id"),
           @Index(name = "idx_wallet_balances_asset", columnList = "asset")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletBalance {

    /**
     * 프로토콜 보관 계정 ID
     */
    public static final long CUSTODY_ACCOUNT_ID = 0L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "asset", nullable = false, length = 50)
    private String asset;

    /**
     * 사용 가능 잔고 (최소 단위 정수)
     */
    @Column(name = "available", nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger available = BigInteger.ZERO;

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
