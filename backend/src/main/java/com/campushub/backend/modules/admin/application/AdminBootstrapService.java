package com.campushub.backend.modules.admin.application;

import java.util.Locale;

import com.campushub.backend.global.security.SecurityUtils;
import com.campushub.backend.modules.auth.application.CampusUserFactory;
import com.campushub.backend.modules.auth.application.UserInputValidator;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.modules.event.domain.Branch;
import com.campushub.backend.modules.event.infrastructure.persistence.BranchRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 설정된 관리자 계정을 생성하거나, 같은 이메일의 기존 계정에 ADMIN 역할을 부여한다.
 */
@Service
public class AdminBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(AdminBootstrapService.class);

    private final CampusUserRepository campusUserRepository;
    private final BranchRepository branchRepository;
    private final CampusUserFactory userFactory;
    private final PasswordEncoder passwordEncoder;

    public AdminBootstrapService(
            CampusUserRepository campusUserRepository,
            BranchRepository branchRepository,
            CampusUserFactory userFactory,
            PasswordEncoder passwordEncoder
    ) {
        this.campusUserRepository = campusUserRepository;
        this.branchRepository = branchRepository;
        this.userFactory = userFactory;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional
    public Long ensureAdmin(AdminAccount account) {
        String email = UserInputValidator.normalizeEmail(account.email());
        return campusUserRepository.findByEmailIgnoreCase(email)
                .map(existing -> {
                    if (!campusUserRepository.existsActiveAdminRole(existing.getId())) {
                        userFactory.grantRole(existing, SecurityUtils.ROLE_ADMIN);
                        campusUserRepository.save(existing);
                        log.info("Granted ADMIN to existing user id={}", existing.getId());
                    } else {
                        log.info("Admin user already exists with id={}", existing.getId());
                    }
                    return existing.getId();
                })
                .orElseGet(() -> createAdmin(email, account));
    }

    private Long createAdmin(String email, AdminAccount account) {
        String branchCode = account.branchCode().trim().toUpperCase(Locale.ROOT);
        Branch branch = branchRepository.findByCode(branchCode)
                .orElseThrow(() -> new IllegalStateException("Unknown branch code for admin bootstrap: " + branchCode));

        CampusUser admin = userFactory.newUser(
                UserInputValidator.normalizeStudentId(account.studentId()),
                UserInputValidator.normalizeUsername(account.username()),
                UserInputValidator.normalizeFullName(account.fullName()),
                email,
                passwordEncoder.encode(UserInputValidator.validatePassword(account.password())),
                UserInputValidator.normalizePhone(account.phone()),
                branch,
                UserInputValidator.validateGraduationYear(account.graduationYear())
        );
        userFactory.grantRole(admin, SecurityUtils.ROLE_ADMIN);
        campusUserRepository.save(admin);
        log.info("Admin user created with id={}", admin.getId());
        return admin.getId();
    }

    public record AdminAccount(
            String email,
            String password,
            String username,
            String fullName,
            String studentId,
            String phone,
            String branchCode,
            Integer graduationYear
    ) {
    }
}
