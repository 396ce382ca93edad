package com.campushub.backend.modules.admin.config;

import com.campushub.backend.modules.admin.application.AdminBootstrapService;
import com.campushub.backend.modules.admin.application.AdminBootstrapService.AdminAccount;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "app.bootstrap.admin", name = "enabled", havingValue = "true")
public class AdminInitializer {

    @Value("${app.bootstrap.admin.email}")
    private String email;

    @Value("${app.bootstrap.admin.password}")
    private String password;

    @Value("${app.bootstrap.admin.username:admin}")
    private String username;

    @Value("${app.bootstrap.admin.full-name:Platform Administrator}")
    private String fullName;

    @Value("${app.bootstrap.admin.student-id:ADMIN001}")
    private String studentId;

    @Value("${app.bootstrap.admin.phone:+10000000000}")
    private String phone;

    @Value("${app.bootstrap.admin.branch-code:CSE}")
    private String branchCode;

    @Value("${app.bootstrap.admin.graduation-year:2030}")
    private Integer graduationYear;

    @Bean
    public CommandLineRunner initializeAdmin(AdminBootstrapService adminBootstrapService) {
        return args -> adminBootstrapService.ensureAdmin(new AdminAccount(
                email, password, username, fullName, studentId, phone, branchCode, graduationYear));
    }
}
