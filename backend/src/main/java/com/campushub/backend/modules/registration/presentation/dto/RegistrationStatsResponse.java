package com.campushub.backend.modules.registration.presentation.dto;

import java.util.Map;

/**
 * 행사별 상태 집계. {@code counts}에는 모든 상태가 항상 포함된다.
 */
public record RegistrationStatsResponse(
        Long eventId,
        int maxSlots,
        long total,
        Map<String, Long> counts
) {
}
