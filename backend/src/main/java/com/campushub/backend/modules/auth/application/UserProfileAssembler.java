package com.campushub.backend.modules.auth.application;

import java.util.List;

import com.campushub.backend.global.security.SecurityUtils;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.domain.UserRole;
import com.campushub.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.campushub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.campushub.backend.modules.event.domain.Branch;

import org.springframework.stereotype.Component;

@Component
public class UserProfileAssembler {

    private final UserRoleRepository userRoleRepository;

    public UserProfileAssembler(UserRoleRepository userRoleRepository) {
        this.userRoleRepository = userRoleRepository;
    }

    public List<String> activeRoleCodes(Long userId) {
        return userRoleRepository.findActiveRoles(userId).stream()
                .map(UserRole::getRole)
                .map(role -> role.getCode())
                .distinct()
                .toList();
    }

    public UserProfileResponse toResponse(CampusUser user) {
        return toResponse(user, activeRoleCodes(user.getId()));
    }

    public UserProfileResponse toResponse(CampusUser user, List<String> roleCodes) {
        Branch branch = user.getBranch();
        return new UserProfileResponse(
                user.getId(),
                user.getStudentId(),
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                user.getPhone(),
                branch != null ? branch.getId() : null,
                branch != null ? branch.getName() : null,
                user.getGraduationYear(),
                user.getStatus().name(),
                roleCodes,
                roleCodes.contains(SecurityUtils.ROLE_ADMIN),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
