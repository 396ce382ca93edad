package com.campushub.backend.modules.audit.infrastructure.persistence;

import java.util.List;

import com.campushub.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByResourceTypeAndResourceKeyOrderByIdAsc(String resourceType, String resourceKey);
}
