package com.campushub.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.campushub.backend.global.error.ProblemException;

import org.junit.jupiter.api.Test;

class UserInputValidatorTest {

    @Test
    void normalizeEmailTrimsAndLowercases() {
        assertThat(UserInputValidator.normalizeEmail("  Ada.Lovelace@Campus.EDU ")).isEqualTo("ada.lovelace@campus.edu");
    }

    @Test
    void normalizeEmailRejectsMalformedAddress() {
        assertProblem(() -> UserInputValidator.normalizeEmail("not-an-email"), "INVALID_EMAIL");
        assertProblem(() -> UserInputValidator.normalizeEmail("  "), "MISSING_FIELD");
    }

    @Test
    void validatePasswordListsEveryUnmetRule() {
        assertThatThrownBy(() -> UserInputValidator.validatePassword("abc"))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getCode()).isEqualTo("INVALID_PASSWORD");
                    assertThat(problem.getDetailMessage())
                            .contains("at least 8 characters")
                            .contains("an uppercase letter")
                            .contains("a digit")
                            .contains("a special character")
                            .doesNotContain("a lowercase letter");
                });
    }

    @Test
    void validatePasswordAcceptsStrongPassword() {
        assertThat(UserInputValidator.validatePassword("Str0ng!pass")).isEqualTo("Str0ng!pass");
    }

    @Test
    void phoneMustBeE164() {
        assertThat(UserInputValidator.normalizePhone("+919876543210")).isEqualTo("+919876543210");
        assertProblem(() -> UserInputValidator.normalizePhone("98-76"), "INVALID_PHONE");
    }

    @Test
    void usernameIsLowercasedAndRestricted() {
        assertThat(UserInputValidator.normalizeUsername("Ada_L")).isEqualTo("ada_l");
        assertProblem(() -> UserInputValidator.normalizeUsername("ab"), "INVALID_USERNAME");
        assertProblem(() -> UserInputValidator.normalizeUsername("has space"), "INVALID_USERNAME");
    }

    @Test
    void studentIdIsUppercased() {
        assertThat(UserInputValidator.normalizeStudentId("cs2024001")).isEqualTo("CS2024001");
        assertProblem(() -> UserInputValidator.normalizeStudentId("cs-01"), "INVALID_INPUT");
    }

    @Test
    void graduationYearMustBeInRange() {
        assertThat(UserInputValidator.validateGraduationYear(2027)).isEqualTo(2027);
        assertProblem(() -> UserInputValidator.validateGraduationYear(2019), "INVALID_GRADUATION_YEAR");
        assertProblem(() -> UserInputValidator.validateGraduationYear(null), "MISSING_FIELD");
    }

    @Test
    void requirePositiveIdRejectsZeroAndNegative() {
        assertThat(UserInputValidator.requirePositiveId(7L, "eventId")).isEqualTo(7L);
        assertProblem(() -> UserInputValidator.requirePositiveId(0L, "eventId"), "INVALID_INPUT");
        assertProblem(() -> UserInputValidator.requirePositiveId(-3L, "eventId"), "INVALID_INPUT");
    }

    private static void assertProblem(Runnable action, String expectedCode) {
        assertThatThrownBy(action::run)
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getCode()).isEqualTo(expectedCode);
                    assertThat(problem.getStatusCode().value()).isEqualTo(400);
                });
    }
}
