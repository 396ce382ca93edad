package com.campushub.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.campushub.backend.global.error.ProblemException;

/**
 * 사용자 입력 필드의 정규화와 검증.
 * 검증 실패는 모두 400 {@link ProblemException}으로 보고한다.
 */
public final class UserInputValidator {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[1-9]\\d{1,14}$");
    private static final Pattern STUDENT_ID = Pattern.compile("^[A-Za-z0-9]{3,20}$");
    private static final Pattern USERNAME = Pattern.compile("^[a-z0-9_.-]{3,20}$");
    private static final Pattern SPECIAL_CHARACTER = Pattern.compile("[^A-Za-z0-9]");

    static final int PASSWORD_MIN_LENGTH = 8;
    static final int FULL_NAME_MIN_LENGTH = 3;
    static final int FULL_NAME_MAX_LENGTH = 100;
    static final int GRADUATION_YEAR_MIN = 2020;
    static final int GRADUATION_YEAR_MAX = 2035;

    private UserInputValidator() {
    }

    public static String normalizeEmail(String raw) {
        String value = requireText(raw, "email");
        String normalized = value.toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(normalized).matches()) {
            throw ProblemException.badRequest("INVALID_EMAIL", "email must be a valid address");
        }
        return normalized;
    }

    public static String normalizePhone(String raw) {
        String value = requireText(raw, "phone");
        if (!PHONE.matcher(value).matches()) {
            throw ProblemException.badRequest("INVALID_PHONE", "phone must be in E.164 format");
        }
        return value;
    }

    public static String normalizeStudentId(String raw) {
        String value = requireText(raw, "studentId");
        if (!STUDENT_ID.matcher(value).matches()) {
            throw ProblemException.badRequest("INVALID_INPUT", "studentId must be 3-20 letters or digits");
        }
        return value.toUpperCase(Locale.ROOT);
    }

    public static String normalizeUsername(String raw) {
        String value = requireText(raw, "username").toLowerCase(Locale.ROOT);
        if (!USERNAME.matcher(value).matches()) {
            throw ProblemException.badRequest(
                    "INVALID_USERNAME",
                    "username must be 3-20 characters of letters, digits, '_', '.' or '-'"
            );
        }
        return value;
    }

    public static String normalizeFullName(String raw) {
        String value = requireText(raw, "fullName");
        if (value.length() < FULL_NAME_MIN_LENGTH || value.length() > FULL_NAME_MAX_LENGTH) {
            throw ProblemException.badRequest("INVALID_INPUT", "fullName must be 3-100 characters");
        }
        return value;
    }

    public static String validatePassword(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw ProblemException.badRequest("MISSING_FIELD", "password is required");
        }
        List<String> unmet = new ArrayList<>();
        if (raw.length() < PASSWORD_MIN_LENGTH) {
            unmet.add("at least " + PASSWORD_MIN_LENGTH + " characters");
        }
        if (raw.chars().noneMatch(Character::isUpperCase)) {
            unmet.add("an uppercase letter");
        }
        if (raw.chars().noneMatch(Character::isLowerCase)) {
            unmet.add("a lowercase letter");
        }
        if (raw.chars().noneMatch(Character::isDigit)) {
            unmet.add("a digit");
        }
        if (!SPECIAL_CHARACTER.matcher(raw).find()) {
            unmet.add("a special character");
        }
        if (!unmet.isEmpty()) {
            throw ProblemException.badRequest("INVALID_PASSWORD", "password must contain " + String.join(", ", unmet));
        }
        return raw;
    }

    public static int validateGraduationYear(Integer year) {
        if (year == null) {
            throw ProblemException.badRequest("MISSING_FIELD", "graduationYear is required");
        }
        if (year < GRADUATION_YEAR_MIN || year > GRADUATION_YEAR_MAX) {
            throw ProblemException.badRequest(
                    "INVALID_GRADUATION_YEAR",
                    "graduationYear must be between " + GRADUATION_YEAR_MIN + " and " + GRADUATION_YEAR_MAX
            );
        }
        return year;
    }

    public static long requirePositiveId(Long id, String field) {
        if (id == null || id <= 0) {
            throw ProblemException.badRequest("INVALID_INPUT", field + " must be a positive integer");
        }
        return id;
    }

    private static String requireText(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw ProblemException.badRequest("MISSING_FIELD", field + " is required");
        }
        return raw.trim();
    }
}
