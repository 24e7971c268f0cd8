package dustin.lending.domains.position.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 원장 계정 엔티티
 * Ledger Account Entity
 *
 * 사용자당 한 행. 잔고 변경 작업은 이 행을 먼저 비관적 락으로 잠가
 * 같은 사용자에 대한 변경 작업을 한 번에 하나로 직렬화합니다.
 */
@Entity
@Table(name = "ledger_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerAccount {

    /**
     * 사용자 ID (자동 생성 아님)
     */
    @Id
    @Column(name = "user_id")
    private Long userId;

    /**
     * 마지막 변경 작업 시각
     */
    @Column(name = "last_operation_at")
    private LocalDateTime lastOperationAt;

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
