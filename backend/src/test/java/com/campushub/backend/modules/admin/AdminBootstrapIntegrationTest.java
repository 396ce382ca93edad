package com.campushub.backend.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.campushub.backend.modules.admin.application.AdminBootstrapService;
import com.campushub.backend.modules.admin.application.AdminBootstrapService.AdminAccount;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.support.AbstractPostgresIntegrationTest;
import com.campushub.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class AdminBootstrapIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private AdminBootstrapService adminBootstrapService;

    @Autowired
    private CampusUserRepository campusUserRepository;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void createsAdminOnceAndIsIdempotent() {
        String suffix = testUserFactory.uniqueSuffix();
        AdminAccount account = account("Root" + suffix + "@CampusHub.local", "root" + suffix, "CSE");

        Long firstId = adminBootstrapService.ensureAdmin(account);
        Long secondId = adminBootstrapService.ensureAdmin(account);

        assertThat(secondId).isEqualTo(firstId);
        assertThat(campusUserRepository.existsActiveAdminRole(firstId)).isTrue();
        assertThat(campusUserRepository.findById(firstId))
                .get()
                .extracting(CampusUser::getEmail)
                .isEqualTo(("root" + suffix + "@campushub.local"));
    }

    @Test
    void grantsAdminToExistingAccount() {
        CampusUser student = testUserFactory.createStudent("promoted");
        assertThat(campusUserRepository.existsActiveAdminRole(student.getId())).isFalse();

        Long id = adminBootstrapService.ensureAdmin(account(student.getEmail(), "ignored", "CSE"));

        assertThat(id).isEqualTo(student.getId());
        assertThat(campusUserRepository.existsActiveAdminRole(student.getId())).isTrue();
    }

    @Test
    void unknownBranchFailsStartup() {
        String suffix = testUserFactory.uniqueSuffix();

        assertThatThrownBy(() -> adminBootstrapService.ensureAdmin(
                account("nobranch" + suffix + "@campushub.local", "nob" + suffix, "XYZ")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("XYZ");
    }

    private static AdminAccount account(String email, String username, String branchCode) {
        return new AdminAccount(
                email,
                "Admin#Pass1",
                username,
                "Platform Administrator",
                "ADM" + username.replaceAll("[^A-Za-z0-9]", "").toUpperCase(),
                "+10000000000",
                branchCode,
                2030
        );
    }
}
