package com.campushub.backend.modules.registration.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.modules.audit.application.AuditLogService;
import com.campushub.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.auth.infrastructure.persistence.CampusUserRepository;
import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.infrastructure.persistence.EventRepository;
import com.campushub.backend.modules.registration.domain.Registration;
import com.campushub.backend.modules.registration.domain.RegistrationStatus;
import com.campushub.backend.modules.registration.domain.RegistrationStatusTransitions;
import com.campushub.backend.modules.registration.infrastructure.persistence.RegistrationRepository;
import com.campushub.backend.modules.registration.infrastructure.persistence.RegistrationRepository.StatusCountProjection;
import com.campushub.backend.modules.registration.presentation.dto.EventRegistrationResponse;
import com.campushub.backend.modules.registration.presentation.dto.MyRegistrationResponse;
import com.campushub.backend.modules.registration.presentation.dto.RegistrationResponse;
import com.campushub.backend.modules.registration.presentation.dto.RegistrationStatsResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 정원/대기열 처리 서비스.
 *
 * <p>모든 변경은 신청을 읽거나 쓰기 전에 행사 행을 먼저 잠그므로 점유 인원 계산과 반영이
 * 서로 끼어들지 않는다. 정원은 CONFIRMED와 ATTENDED 신청이 차지한다.
 * 점유 인원이 {@code maxSlots} 미만이면 확정, 아니면 대기로 등록하며,
 * 확정 신청이 취소되면 같은 행사의 가장 오래된 대기 신청을 확정으로 올린다.
 */
@Service
@Transactional
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final String RESOURCE_TYPE = "REGISTRATION";
    static final String ACTION_CREATED = "REGISTRATION_CREATED";
    static final String ACTION_CANCELLED = "REGISTRATION_CANCELLED";
    static final String ACTION_PROMOTED = "REGISTRATION_PROMOTED";
    static final String ACTION_STATUS_UPDATED = "REGISTRATION_STATUS_UPDATED";

    private static final String ACTIVE_REGISTRATION_INDEX = "uq_registration_active_user_event";

    private final RegistrationRepository registrationRepository;
    private final EventRepository eventRepository;
    private final CampusUserRepository campusUserRepository;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public RegistrationService(
            RegistrationRepository registrationRepository,
            EventRepository eventRepository,
            CampusUserRepository campusUserRepository,
            AuditLogService auditLogService,
            Clock clock
    ) {
        this.registrationRepository = registrationRepository;
        this.eventRepository = eventRepository;
        this.campusUserRepository = campusUserRepository;
        this.auditLogService = auditLogService;
        this.clock = clock;
    }

    public RegistrationResponse register(Long userId, Long eventId) {
        CampusUser user = campusUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found: " + userId));
        if (!user.isActive()) {
            throw ProblemException.forbidden("USER_INACTIVE", "This account has been deactivated");
        }

        Event event = lockEvent(eventId);
        if (!event.isOpenForRegistration()) {
            throw ProblemException.conflict("EVENT_NOT_OPEN", "Event is not open for registration");
        }
        if (registrationRepository.existsActive(userId, eventId)) {
            throw ProblemException.conflict("ALREADY_REGISTERED", "You are already registered for this event");
        }

        long occupied = registrationRepository.countOccupiedSlots(eventId);
        RegistrationStatus status = occupied < event.getMaxSlots()
                ? RegistrationStatus.CONFIRMED
                : RegistrationStatus.WAITLISTED;

        Registration registration = new Registration();
        registration.setUser(user);
        registration.setEvent(event);
        registration.setRegisteredAt(OffsetDateTime.now(clock));
        registration.setStatus(status);

        try {
            registrationRepository.saveAndFlush(registration);
        } catch (DataIntegrityViolationException ex) {
            if (isActiveRegistrationViolation(ex)) {
                throw ProblemException.conflict("ALREADY_REGISTERED", "You are already registered for this event");
            }
            throw ex;
        }

        audit(ACTION_CREATED, registration, userId, Map.of(
                "eventId", eventId,
                "status", status.name(),
                "occupiedBefore", occupied
        ));
        log.info("Registration {} for event {} by user {} -> {} ({}/{} slots held before)",
                registration.getId(), eventId, userId, status, occupied, event.getMaxSlots());
        return RegistrationResponse.from(registration);
    }

    /**
     * 신청자 본인 또는 관리자가 신청을 취소한다.
     *
     * @param routeEventId 요청 경로의 행사 ID. 다른 행사의 신청이면 찾을 수 없음으로 응답한다.
     *                     {@code null}이면 확인하지 않는다.
     */
    public RegistrationResponse cancel(Long routeEventId, Long registrationId, Long actorId) {
        Long eventId = resolveEventId(registrationId);
        if (routeEventId != null && !routeEventId.equals(eventId)) {
            throw registrationNotFound(registrationId);
        }
        Event event = lockEvent(eventId);
        Registration registration = lockRegistration(registrationId);

        if (!registration.isOwnedBy(actorId) && !campusUserRepository.existsActiveAdminRole(actorId)) {
            throw ProblemException.forbidden("FORBIDDEN", "You can only cancel your own registrations");
        }

        RegistrationStatus previous = registration.getStatus();
        if (previous == RegistrationStatus.CANCELLED) {
            throw ProblemException.conflict("ALREADY_CANCELLED", "Registration is already cancelled");
        }
        ensureTransition(registration, RegistrationStatus.CANCELLED);

        registration.setStatus(RegistrationStatus.CANCELLED);
        audit(ACTION_CANCELLED, registration, actorId, Map.of("eventId", eventId, "from", previous.name()));
        log.info("Registration {} for event {} cancelled by user {} (was {})",
                registrationId, eventId, actorId, previous);

        if (previous == RegistrationStatus.CONFIRMED) {
            promoteNextWaitlisted(event, actorId);
        }
        return RegistrationResponse.from(registration);
    }

    public RegistrationResponse updateStatus(
            Long registrationId,
            RegistrationStatus newStatus,
            String reason,
            Long actorId
    ) {
        if (newStatus == null) {
            throw ProblemException.badRequest("INVALID_INPUT", "status is required");
        }
        if (!campusUserRepository.existsActiveAdminRole(actorId)) {
            throw ProblemException.forbidden("FORBIDDEN", "Only administrators can change registration status");
        }

        Long eventId = resolveEventId(registrationId);
        Event event = lockEvent(eventId);
        Registration registration = lockRegistration(registrationId);

        RegistrationStatus previous = registration.getStatus();
        ensureTransition(registration, newStatus);

        if (newStatus == RegistrationStatus.CONFIRMED) {
            long occupied = registrationRepository.countOccupiedSlots(eventId);
            if (occupied >= event.getMaxSlots()) {
                throw ProblemException.conflict(
                        "CAPACITY_EXCEEDED",
                        "Event has no free slots (" + occupied + "/" + event.getMaxSlots() + ")"
                );
            }
        }

        registration.setStatus(newStatus);
        String normalizedReason = normalizeReason(reason);
        if (normalizedReason != null) {
            registration.setStatusReason(normalizedReason);
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("eventId", eventId);
        detail.put("from", previous.name());
        detail.put("to", newStatus.name());
        if (normalizedReason != null) {
            detail.put("reason", normalizedReason);
        }
        audit(ACTION_STATUS_UPDATED, registration, actorId, detail);
        log.info("Registration {} for event {} moved {} -> {} by admin {}",
                registrationId, eventId, previous, newStatus, actorId);

        if (previous == RegistrationStatus.CONFIRMED && newStatus == RegistrationStatus.CANCELLED) {
            promoteNextWaitlisted(event, actorId);
        }
        return RegistrationResponse.from(registration);
    }

    @Transactional(readOnly = true)
    public RegistrationStatsResponse getEventRegistrationStats(Long eventId) {
        Event event = eventRepository.findById(eventId)
                .orElseThrow(() -> eventNotFound(eventId));

        Map<RegistrationStatus, Long> byStatus = new EnumMap<>(RegistrationStatus.class);
        for (RegistrationStatus status : RegistrationStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (StatusCountProjection row : registrationRepository.countByStatus(eventId)) {
            byStatus.put(row.getStatus(), row.getTotal());
        }

        Map<String, Long> counts = new LinkedHashMap<>();
        long total = 0;
        for (Map.Entry<RegistrationStatus, Long> entry : byStatus.entrySet()) {
            counts.put(entry.getKey().name(), entry.getValue());
            total += entry.getValue();
        }
        return new RegistrationStatsResponse(eventId, event.getMaxSlots(), total, counts);
    }

    @Transactional(readOnly = true)
    public List<EventRegistrationResponse> listEventRegistrations(Long eventId) {
        if (!eventRepository.existsById(eventId)) {
            throw eventNotFound(eventId);
        }
        return registrationRepository.findByEventIdWithUser(eventId).stream()
                .map(EventRegistrationResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<MyRegistrationResponse> listMyRegistrations(Long userId) {
        return registrationRepository.findByUserIdWithEvent(userId).stream()
                .map(MyRegistrationResponse::from)
                .toList();
    }

    /**
     * 빈 자리가 있으면 가장 먼저 대기한 신청을 확정으로 올린다.
     * 호출자가 행사 잠금을 잡고 있어야 한다.
     */
    Optional<Registration> promoteNextWaitlisted(Event event, Long actorId) {
        if (registrationRepository.countOccupiedSlots(event.getId()) >= event.getMaxSlots()) {
            return Optional.empty();
        }
        Optional<Registration> next = registrationRepository
                .findFirstByEventIdAndStatusOrderByIdAsc(event.getId(), RegistrationStatus.WAITLISTED);
        next.ifPresent(promoted -> {
            promoted.setStatus(RegistrationStatus.CONFIRMED);
            audit(ACTION_PROMOTED, promoted, actorId, Map.of("eventId", event.getId(), "from", "WAITLISTED"));
            log.info("Registration {} promoted from waitlist for event {}", promoted.getId(), event.getId());
        });
        return next;
    }

    private Long resolveEventId(Long registrationId) {
        return registrationRepository.findEventIdById(registrationId)
                .orElseThrow(() -> registrationNotFound(registrationId));
    }

    private Event lockEvent(Long eventId) {
        return eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> eventNotFound(eventId));
    }

    private Registration lockRegistration(Long registrationId) {
        return registrationRepository.findByIdForUpdate(registrationId)
                .orElseThrow(() -> registrationNotFound(registrationId));
    }

    private void ensureTransition(Registration registration, RegistrationStatus target) {
        try {
            RegistrationStatusTransitions.validate(registration.getStatus(), target);
        } catch (ProblemException ex) {
            log.debug("Rejected transition of registration {}: {} -> {}",
                    registration.getId(), registration.getStatus(), target);
            throw ex;
        }
    }

    private void audit(String action, Registration registration, Long actorId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(
                action,
                RESOURCE_TYPE,
                String.valueOf(registration.getId()),
                actorId,
                detail
        ));
    }

    private static String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        return reason.trim();
    }

    private static boolean isActiveRegistrationViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(ACTIVE_REGISTRATION_INDEX);
    }

    private static ProblemException registrationNotFound(Long registrationId) {
        return ProblemException.notFound("REGISTRATION_NOT_FOUND", "Registration not found: " + registrationId);
    }

    private static ProblemException eventNotFound(Long eventId) {
        return ProblemException.notFound("EVENT_NOT_FOUND", "Event not found: " + eventId);
    }
}
