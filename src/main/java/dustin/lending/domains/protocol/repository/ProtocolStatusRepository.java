package dustin.lending.domains.protocol.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.lending.domains.protocol.model.entity.ProtocolStatus;

@Repository
public interface ProtocolStatusRepository extends JpaRepository<ProtocolStatus, Long> {
}
