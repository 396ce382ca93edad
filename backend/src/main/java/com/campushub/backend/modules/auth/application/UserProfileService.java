package com.campushub.backend.modules.auth.application;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.global.security.JwtAuthenticationPrincipal;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.campushub.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class UserProfileService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileService.class);

    private final CampusUserRepository campusUserRepository;
    private final UserProfileAssembler profileAssembler;
    private final PasswordEncoder passwordEncoder;

    public UserProfileService(
            CampusUserRepository campusUserRepository,
            UserProfileAssembler profileAssembler,
            PasswordEncoder passwordEncoder
    ) {
        this.campusUserRepository = campusUserRepository;
        this.profileAssembler = profileAssembler;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(Long userId, JwtAuthenticationPrincipal actor) {
        UserInputValidator.requirePositiveId(userId, "userId");
        if (!actor.userId().equals(userId) && !actor.isAdmin()) {
            throw ProblemException.forbidden("FORBIDDEN", "You can only view your own profile");
        }
        return profileAssembler.toResponse(loadUser(userId));
    }

    public UserProfileResponse updateProfile(Long userId, UpdateProfileRequest request, JwtAuthenticationPrincipal actor) {
        UserInputValidator.requirePositiveId(userId, "userId");
        if (!actor.userId().equals(userId)) {
            throw ProblemException.forbidden("FORBIDDEN", "You can only update your own profile");
        }
        if (request == null || request.isEmpty()) {
            throw ProblemException.badRequest("NO_UPDATE_FIELDS", "No fields to update");
        }

        String fullName = request.fullName() != null ? UserInputValidator.normalizeFullName(request.fullName()) : null;
        String phone = request.phone() != null ? UserInputValidator.normalizePhone(request.phone()) : null;
        String password = request.password() != null ? UserInputValidator.validatePassword(request.password()) : null;

        CampusUser user = loadUser(userId);
        if (password != null) {
            if (request.oldPassword() == null || !passwordEncoder.matches(request.oldPassword(), user.getPasswordHash())) {
                throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_OLD_PASSWORD", "Current password is incorrect");
            }
            user.setPasswordHash(passwordEncoder.encode(password));
        }
        if (fullName != null) {
            user.setFullName(fullName);
        }
        if (phone != null) {
            user.setPhone(phone);
        }
        campusUserRepository.flush();

        log.info("User id={} updated profile", userId);
        return profileAssembler.toResponse(user);
    }

    private CampusUser loadUser(Long userId) {
        return campusUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found: " + userId));
    }
}
