package com.campushub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.domain.Role;
import com.campushub.backend.modules.auth.domain.UserRole;
import com.campushub.backend.modules.auth.domain.UserStatus;
import com.campushub.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.campushub.backend.modules.event.domain.Branch;

import org.springframework.stereotype.Component;

/**
 * 정규화가 끝난 입력으로 새 계정을 만든다. 회원가입과 관리자 초기화가 함께 사용한다.
 */
@Component
public class CampusUserFactory {

    private final RoleRepository roleRepository;
    private final Clock clock;

    public CampusUserFactory(RoleRepository roleRepository, Clock clock) {
        this.roleRepository = roleRepository;
        this.clock = clock;
    }

    public CampusUser newUser(
            String studentId,
            String username,
            String fullName,
            String email,
            String passwordHash,
            String phone,
            Branch branch,
            int graduationYear
    ) {
        CampusUser user = new CampusUser();
        user.setStudentId(studentId);
        user.setUsername(username);
        user.setFullName(fullName);
        user.setEmail(email);
        user.setPasswordHash(passwordHash);
        user.setPhone(phone);
        user.setBranch(branch);
        user.setGraduationYear(graduationYear);
        user.setStatus(UserStatus.ACTIVE);
        return user;
    }

    public void grantRole(CampusUser user, String roleCode) {
        Role role = roleRepository.findById(roleCode)
                .orElseThrow(() -> new IllegalStateException("Role not seeded: " + roleCode));
        UserRole userRole = new UserRole();
        userRole.setUser(user);
        userRole.setRole(role);
        userRole.setGrantedAt(OffsetDateTime.now(clock));
        user.getRoles().add(userRole);
    }
}
