package com.campushub.backend.modules.registration.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.campushub.backend.global.error.ProblemException;

/**
 * 신청 상태 전이 규칙. ATTENDED와 CANCELLED는 종료 상태이며
 * 같은 상태로의 전이는 허용하지 않는다.
 */
public final class RegistrationStatusTransitions {

    private static final Map<RegistrationStatus, Set<RegistrationStatus>> ALLOWED;

    static {
        Map<RegistrationStatus, Set<RegistrationStatus>> table = new EnumMap<>(RegistrationStatus.class);
        table.put(RegistrationStatus.PENDING, EnumSet.of(
                RegistrationStatus.CONFIRMED, RegistrationStatus.CANCELLED, RegistrationStatus.WAITLISTED));
        table.put(RegistrationStatus.CONFIRMED, EnumSet.of(RegistrationStatus.ATTENDED, RegistrationStatus.CANCELLED));
        table.put(RegistrationStatus.WAITLISTED, EnumSet.of(RegistrationStatus.CONFIRMED, RegistrationStatus.CANCELLED));
        table.put(RegistrationStatus.ATTENDED, EnumSet.noneOf(RegistrationStatus.class));
        table.put(RegistrationStatus.CANCELLED, EnumSet.noneOf(RegistrationStatus.class));
        ALLOWED = Collections.unmodifiableMap(table);
    }

    private RegistrationStatusTransitions() {
    }

    public static boolean isAllowed(RegistrationStatus from, RegistrationStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return ALLOWED.get(from).contains(to);
    }

    public static Set<RegistrationStatus> allowedTargets(RegistrationStatus from) {
        if (from == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    /**
     * @throws ProblemException 허용되지 않은 전이면 409 {@code INVALID_STATUS_TRANSITION}
     */
    public static void validate(RegistrationStatus from, RegistrationStatus to) {
        if (!isAllowed(from, to)) {
            throw ProblemException.conflict(
                    "INVALID_STATUS_TRANSITION",
                    "Cannot change registration status from " + from + " to " + to
                            + " (allowed: " + describeTargets(from) + ")"
            );
        }
    }

    private static String describeTargets(RegistrationStatus from) {
        Set<RegistrationStatus> targets = allowedTargets(from);
        if (targets.isEmpty()) {
            return "none";
        }
        return targets.stream().map(Enum::name).collect(Collectors.joining(", "));
    }
}
