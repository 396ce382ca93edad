package com.campushub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.global.security.SecurityUtils;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.domain.UserSession;
import com.campushub.backend.modules.auth.domain.UserStatus;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.campushub.backend.modules.auth.presentation.dto.LoginRequest;
import com.campushub.backend.modules.auth.presentation.dto.LoginResponse;
import com.campushub.backend.modules.auth.presentation.dto.LogoutRequest;
import com.campushub.backend.modules.auth.presentation.dto.RefreshRequest;
import com.campushub.backend.modules.auth.presentation.dto.SignupRequest;
import com.campushub.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.campushub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.campushub.backend.modules.event.domain.Branch;
import com.campushub.backend.modules.event.infrastructure.persistence.BranchRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final String REASON_LOGOUT_ALL = "LOGOUT_ALL";
    private static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    private static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    private static final String INVALID_CREDENTIALS_DETAIL = "Invalid email or password";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final CampusUserRepository campusUserRepository;
    private final BranchRepository branchRepository;
    private final UserSessionRepository userSessionRepository;
    private final UserProfileAssembler profileAssembler;
    private final CampusUserFactory userFactory;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            CampusUserRepository campusUserRepository,
            BranchRepository branchRepository,
            UserSessionRepository userSessionRepository,
            UserProfileAssembler profileAssembler,
            CampusUserFactory userFactory,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.campusUserRepository = campusUserRepository;
        this.branchRepository = branchRepository;
        this.userSessionRepository = userSessionRepository;
        this.profileAssembler = profileAssembler;
        this.userFactory = userFactory;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    @Transactional
    public UserProfileResponse signup(SignupRequest request) {
        String studentId = UserInputValidator.normalizeStudentId(request.studentId());
        String username = UserInputValidator.normalizeUsername(request.username());
        String fullName = UserInputValidator.normalizeFullName(request.fullName());
        String email = UserInputValidator.normalizeEmail(request.email());
        String password = UserInputValidator.validatePassword(request.password());
        String phone = UserInputValidator.normalizePhone(request.phone());
        long branchId = UserInputValidator.requirePositiveId(request.branchId(), "branchId");
        int graduationYear = UserInputValidator.validateGraduationYear(request.graduationYear());

        if (campusUserRepository.existsByEmail(email)) {
            throw ProblemException.conflict("DUPLICATE_EMAIL", "An account with this email already exists");
        }
        if (campusUserRepository.existsByStudentId(studentId)) {
            throw ProblemException.conflict("DUPLICATE_STUDENT_ID", "An account with this student id already exists");
        }
        if (campusUserRepository.existsByUsername(username)) {
            throw ProblemException.conflict("DUPLICATE_USERNAME", "This username is already taken");
        }

        Branch branch = branchRepository.findById(branchId)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_BRANCH", "Unknown branch: " + branchId));

        CampusUser user = userFactory.newUser(studentId, username, fullName, email, passwordEncoder.encode(password), phone,
                branch, graduationYear);
        userFactory.grantRole(user, SecurityUtils.ROLE_STUDENT);

        try {
            campusUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw mapDuplicateAccount(ex);
        }

        log.info("Registered user id={} studentId={}", user.getId(), studentId);
        return profileAssembler.toResponse(user, List.of(SecurityUtils.ROLE_STUDENT));
    }

    public LoginResponse login(LoginRequest request) {
        String email = request.email().trim();
        CampusUser user = campusUserRepository.findByEmailIgnoreCase(email)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS",
                        INVALID_CREDENTIALS_DETAIL));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", INVALID_CREDENTIALS_DETAIL);
        }

        if (user.getStatus() != UserStatus.ACTIVE) {
            throw ProblemException.forbidden("USER_INACTIVE", "This account has been deactivated");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        List<String> roleCodes = profileAssembler.activeRoleCodes(user.getId());
        LoginResponse response = issueSession(user, roleCodes, normalizeDeviceId(request.deviceId()));
        log.info("User id={} logged in", user.getId());
        return response;
    }

    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(RefreshTokenHasher.hash(request.refreshToken()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.isRevoked()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (session.isExpired(now)) {
            session.revoke(now, REASON_EXPIRED);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            session.revoke(now, REASON_DEVICE_MISMATCH);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        CampusUser user = session.getUser();
        if (!user.isActive()) {
            session.revoke(now, REASON_USER_INACTIVE);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        // 리프레시 토큰은 한 번만 사용할 수 있다
        session.revoke(now, REASON_ROTATED);

        List<String> roleCodes = profileAssembler.activeRoleCodes(user.getId());
        String effectiveDeviceId = requestDeviceId != null ? requestDeviceId : sessionDeviceId;
        return issueSession(user, roleCodes, effectiveDeviceId);
    }

    public void logout(LogoutRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        String tokenHash = RefreshTokenHasher.hash(request.refreshToken());
        if (request.revokeAllDevices()) {
            Optional<UserSession> session = userSessionRepository.findByRefreshTokenHash(tokenHash)
                    .filter(candidate -> !candidate.isRevoked());
            if (session.isPresent()) {
                Long userId = session.get().getUser().getId();
                int revoked = userSessionRepository.revokeActiveSessions(userId, now, REASON_LOGOUT_ALL);
                log.info("User id={} logged out of {} session(s)", userId, revoked);
                return;
            }
        }
        int updated = userSessionRepository.revokeByRefreshTokenHash(tokenHash, now, REASON_LOGOUT);
        if (updated == 0) {
            log.debug("Logout with unknown or already revoked refresh token");
        }
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(Long userId) {
        CampusUser user = campusUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found: " + userId));
        return profileAssembler.toResponse(user);
    }

    private LoginResponse issueSession(CampusUser user, List<String> roleCodes, String deviceId) {
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail(), roleCodes, refreshToken);

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(RefreshTokenHasher.hash(refreshToken));
        session.setIssuedAt(tokens.issuedAt());
        session.setExpiresAt(tokens.refreshExpiresAt());
        session.setDeviceId(deviceId);
        userSessionRepository.save(session);

        return new LoginResponse(tokens, profileAssembler.toResponse(user, roleCodes));
    }

    private ProblemException mapDuplicateAccount(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage() == null ? "" : root.getMessage();
        if (message.contains("uq_campus_user_email")) {
            return ProblemException.conflict("DUPLICATE_EMAIL", "An account with this email already exists");
        }
        if (message.contains("uq_campus_user_student_id")) {
            return ProblemException.conflict("DUPLICATE_STUDENT_ID", "An account with this student id already exists");
        }
        if (message.contains("uq_campus_user_username")) {
            return ProblemException.conflict("DUPLICATE_USERNAME", "This username is already taken");
        }
        throw ex;
    }

    private String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > DEVICE_ID_MAX_LENGTH ? trimmed.substring(0, DEVICE_ID_MAX_LENGTH) : trimmed;
    }
}
