package dustin.lending.domains.protocol.model.entity;

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
 * 프로토콜 상태 엔티티
 * Protocol Status Entity
 *
 * 단일 행 (id = 1). 전역 일시 정지 플래그를 보관합니다.
 */
@Entity
@Table(name = "protocol_status")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolStatus {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "paused", nullable = false)
    private Boolean paused;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }
}
