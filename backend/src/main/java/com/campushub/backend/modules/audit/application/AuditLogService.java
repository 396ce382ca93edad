package com.campushub.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import com.campushub.backend.global.web.RequestIdFilter;
import com.campushub.backend.modules.audit.domain.AuditLog;
import com.campushub.backend.modules.audit.infrastructure.persistence.AuditLogRepository;
import com.campushub.backend.modules.auth.domain.CampusUser;

import jakarta.persistence.EntityManager;

import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    /**
     * 호출자의 트랜잭션에 참여하므로 감사 기록은 대상 변경과 함께 커밋되거나 롤백된다.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setRequestId(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorUserId() != null) {
            auditLog.setActor(entityManager.getReference(CampusUser.class, command.actorUserId()));
        }

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            Long actorUserId,
            Map<String, Object> detail
    ) {
    }
}
