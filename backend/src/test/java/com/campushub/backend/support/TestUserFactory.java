package com.campushub.backend.support;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.campushub.backend.modules.auth.application.JwtTokenService;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.domain.Role;
import com.campushub.backend.modules.auth.domain.UserRole;
import com.campushub.backend.modules.auth.domain.UserStatus;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.modules.auth.infrastructure.persistence.RoleRepository;
import com.campushub.backend.modules.auth.infrastructure.persistence.UserRoleRepository;
import com.campushub.backend.modules.event.domain.Branch;
import com.campushub.backend.modules.event.infrastructure.persistence.BranchRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates uniquely named accounts so tests sharing one database never collide.
 */
@Component
@Transactional
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "Passw0rd!";

    private static final AtomicInteger SEQUENCE = new AtomicInteger((int) (System.nanoTime() % 100_000));

    private final CampusUserRepository campusUserRepository;
    private final RoleRepository roleRepository;
    private final UserRoleRepository userRoleRepository;
    private final BranchRepository branchRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    private String defaultPasswordHash;

    public TestUserFactory(
            CampusUserRepository campusUserRepository,
            RoleRepository roleRepository,
            UserRoleRepository userRoleRepository,
            BranchRepository branchRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.campusUserRepository = campusUserRepository;
        this.roleRepository = roleRepository;
        this.userRoleRepository = userRoleRepository;
        this.branchRepository = branchRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public CampusUser createStudent(String prefix) {
        CampusUser user = createUser(prefix);
        grantRole(user, "STUDENT");
        return user;
    }

    public CampusUser createAdmin(String prefix) {
        CampusUser user = createUser(prefix);
        grantRole(user, "ADMIN");
        return user;
    }

    public String accessToken(CampusUser user) {
        List<String> roles = userRoleRepository.findActiveRoles(user.getId()).stream()
                .map(userRole -> userRole.getRole().getCode())
                .toList();
        return jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), roles, "unused").accessToken();
    }

    public String bearer(CampusUser user) {
        return "Bearer " + accessToken(user);
    }

    public String uniqueSuffix() {
        return Integer.toString(SEQUENCE.incrementAndGet());
    }

    private CampusUser createUser(String prefix) {
        String suffix = uniqueSuffix();
        String handle = (prefix + suffix).toLowerCase();
        Branch branch = branchRepository.findByCode("CSE")
                .orElseThrow(() -> new IllegalStateException("Seed branch CSE missing"));

        CampusUser user = new CampusUser();
        user.setStudentId(("S" + prefix + suffix).toUpperCase().replaceAll("[^A-Z0-9]", ""));
        user.setUsername(handle.length() > 20 ? handle.substring(handle.length() - 20) : handle);
        user.setFullName("Test " + prefix + " " + suffix);
        user.setEmail(handle + "@example.com");
        user.setPasswordHash(defaultPasswordHash());
        user.setPhone("+1555" + String.format("%07d", Integer.parseInt(suffix) % 10_000_000));
        user.setBranch(branch);
        user.setGraduationYear(2027);
        user.setStatus(UserStatus.ACTIVE);
        return campusUserRepository.save(user);
    }

    private void grantRole(CampusUser user, String roleCode) {
        Role role = roleRepository.findById(roleCode)
                .orElseThrow(() -> new IllegalStateException("Role not found: " + roleCode));
        UserRole userRole = new UserRole();
        userRole.setUser(user);
        userRole.setRole(role);
        userRole.setGrantedAt(OffsetDateTime.now(ZoneOffset.UTC));
        userRoleRepository.save(userRole);
    }

    private synchronized String defaultPasswordHash() {
        if (defaultPasswordHash == null) {
            defaultPasswordHash = passwordEncoder.encode(DEFAULT_PASSWORD);
        }
        return defaultPasswordHash;
    }
}
