package com.apex.guardian.repository;

import com.apex.guardian.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByAccountIdAndOperationOrderByTimestampDesc(String accountId, String operation);
}
