package com.campushub.backend.modules.admin.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.modules.audit.application.AuditLogService;
import com.campushub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.domain.UserStatus;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AdminUserService {

    private static final Logger log = LoggerFactory.getLogger(AdminUserService.class);
    private static final String REASON_DEACTIVATED = "ACCOUNT_DEACTIVATED";

    private final CampusUserRepository campusUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public AdminUserService(
            CampusUserRepository campusUserRepository,
            UserSessionRepository userSessionRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.campusUserRepository = campusUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    /**
     * 계정을 비활성화하고 세션을 모두 폐기한다. 이미 비활성인 계정이면 아무것도 하지 않는다.
     */
    public void deactivateUser(@NonNull Long targetUserId, Long actorUserId, String reason) {
        CampusUser target = campusUserRepository.findById(targetUserId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found: " + targetUserId));
        if (target.getStatus() == UserStatus.INACTIVE) {
            return;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        target.setStatus(UserStatus.INACTIVE);
        target.setDeactivatedAt(now);
        int revoked = userSessionRepository.revokeActiveSessions(targetUserId, now, REASON_DEACTIVATED);

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("revokedSessions", revoked);
        if (reason != null && !reason.isBlank()) {
            detail.put("reason", reason.trim());
        }
        auditLogService.record(new AuditLogCommand(
                "USER_DEACTIVATED",
                "USER",
                String.valueOf(targetUserId),
                actorUserId,
                detail
        ));
        log.info("User {} deactivated by admin {} ({} sessions revoked)", targetUserId, actorUserId, revoked);
    }
}
