package com.campushub.backend.modules.registration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.campushub.backend.modules.auth.domain.CampusUser;
import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.domain.EventStatus;
import com.campushub.backend.modules.registration.domain.Registration;
import com.campushub.backend.modules.registration.domain.RegistrationStatus;
import com.campushub.backend.modules.registration.infrastructure.persistence.RegistrationRepository;
import com.campushub.backend.support.AbstractPostgresIntegrationTest;
import com.campushub.backend.support.TestEventFactory;
import com.campushub.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class RegistrationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private TestEventFactory testEventFactory;

    @Autowired
    private RegistrationRepository registrationRepository;

    @Test
    void fullEventWaitlistsAndPromotesOldestOnCancellation() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Waitlist Workshop", 2);
        CampusUser alice = testUserFactory.createStudent("alice");
        CampusUser bob = testUserFactory.createStudent("bob");
        CampusUser carol = testUserFactory.createStudent("carol");
        CampusUser admin = testUserFactory.createAdmin("regadmin");

        long aliceReg = register(alice, event, "CONFIRMED");
        register(bob, event, "CONFIRMED");
        long carolReg = register(carol, event, "WAITLISTED");

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), aliceReg)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(alice)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regStatus").value("CANCELLED"));

        mockMvc.perform(get("/registrations/me")
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(carol)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].regId").value(carolReg))
                .andExpect(jsonPath("$[0].regStatus").value("CONFIRMED"));

        mockMvc.perform(get("/events/{eventId}/registrations/stats", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxSlots").value(2))
                .andExpect(jsonPath("$.total").value(3))
                .andExpect(jsonPath("$.counts.CONFIRMED").value(2))
                .andExpect(jsonPath("$.counts.WAITLISTED").value(0))
                .andExpect(jsonPath("$.counts.CANCELLED").value(1))
                .andExpect(jsonPath("$.counts.PENDING").value(0));

        mockMvc.perform(get("/events/{eventId}", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.confirmedCount").value(2));
    }

    @Test
    void cancellingWaitlistedRegistrationLeavesConfirmedUntouched() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Single Seat Talk", 1);
        CampusUser first = testUserFactory.createStudent("first");
        CampusUser second = testUserFactory.createStudent("second");
        CampusUser admin = testUserFactory.createAdmin("regadmin");

        register(first, event, "CONFIRMED");
        long secondReg = register(second, event, "WAITLISTED");

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), secondReg)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(second)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regStatus").value("CANCELLED"));

        mockMvc.perform(get("/events/{eventId}/registrations/stats", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.CONFIRMED").value(1))
                .andExpect(jsonPath("$.counts.CANCELLED").value(1))
                .andExpect(jsonPath("$.counts.WAITLISTED").value(0));
    }

    @Test
    void duplicateRegistrationIsRejectedButReRegistrationAfterCancelIsAllowed() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Repeat Seminar", 5);
        CampusUser student = testUserFactory.createStudent("repeat");

        long regId = register(student, event, "CONFIRMED");

        mockMvc.perform(post("/events/{eventId}/registrations", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_REGISTERED"));

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), regId)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), regId)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_CANCELLED"));

        register(student, event, "CONFIRMED");
    }

    @Test
    void registrationRequiresPublishedOpenEvent() throws Exception {
        Event draft = testEventFactory.createEvent("Hidden Draft", 5, false, EventStatus.DRAFT);
        Event cancelled = testEventFactory.createEvent("Called Off", 5, true, EventStatus.CANCELLED);
        CampusUser student = testUserFactory.createStudent("closed");

        mockMvc.perform(post("/events/{eventId}/registrations", draft.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_OPEN"));

        mockMvc.perform(post("/events/{eventId}/registrations", cancelled.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_OPEN"));

        mockMvc.perform(post("/events/{eventId}/registrations", Long.MAX_VALUE)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("EVENT_NOT_FOUND"));
    }

    @Test
    void pathIdsAndAuthenticationAreChecked() throws Exception {
        CampusUser student = testUserFactory.createStudent("paths");

        mockMvc.perform(post("/events/{eventId}/registrations", 0)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        mockMvc.perform(post("/events/{eventId}/registrations", "abc")
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));

        mockMvc.perform(post("/events/{eventId}/registrations", 1))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));

        mockMvc.perform(post("/events/{eventId}/registrations", 1)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-token"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));

        mockMvc.perform(get("/events/{eventId}/registrations/stats", 1)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(student)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void otherStudentCannotCancelButAdminCan() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Guarded Lab", 3);
        CampusUser owner = testUserFactory.createStudent("owner");
        CampusUser intruder = testUserFactory.createStudent("intruder");
        CampusUser admin = testUserFactory.createAdmin("canceladmin");

        long regId = register(owner, event, "CONFIRMED");

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), regId)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(intruder)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId() + 100_000, regId)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(owner)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("REGISTRATION_NOT_FOUND"));

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), regId)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regStatus").value("CANCELLED"));
    }

    @Test
    void adminStatusChangesFollowTransitionTable() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Attendance Drill", 1);
        CampusUser attendee = testUserFactory.createStudent("attendee");
        CampusUser waiting = testUserFactory.createStudent("waiting");
        CampusUser admin = testUserFactory.createAdmin("statusadmin");

        long attendeeReg = register(attendee, event, "CONFIRMED");
        long waitingReg = register(waiting, event, "WAITLISTED");

        updateStatus(admin, waitingReg, "CONFIRMED")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CAPACITY_EXCEEDED"));

        updateStatus(admin, attendeeReg, "CONFIRMED")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS_TRANSITION"));

        mockMvc.perform(put("/registrations/{registrationId}", attendeeReg)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(admin))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"status": "ATTENDED", "reason": "checked in at gate"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regStatus").value("ATTENDED"))
                .andExpect(jsonPath("$.statusReason").value("checked in at gate"));

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), attendeeReg)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(attendee)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS_TRANSITION"));

        updateStatus(admin, waitingReg, "PENDING")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS_TRANSITION"));

        updateStatus(admin, waitingReg, "UNKNOWN")
                .andExpect(status().isBadRequest());

        updateStatus(testUserFactory.createStudent("sneaky"), waitingReg, "CANCELLED")
                .andExpect(status().isForbidden());

        mockMvc.perform(get("/events/{eventId}/registrations", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].regId").value(waitingReg))
                .andExpect(jsonPath("$[0].email").value(waiting.getEmail()));
    }

    @Test
    void attendedSlotStaysTakenSoNewcomersQueueBehindWaitlist() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Check-in Clinic", 1);
        CampusUser attendee = testUserFactory.createStudent("early");
        CampusUser waiting = testUserFactory.createStudent("queued");
        CampusUser newcomer = testUserFactory.createStudent("late");
        CampusUser admin = testUserFactory.createAdmin("checkin");

        long attendeeReg = register(attendee, event, "CONFIRMED");
        long waitingReg = register(waiting, event, "WAITLISTED");

        updateStatus(admin, attendeeReg, "ATTENDED")
                .andExpect(status().isOk());

        register(newcomer, event, "WAITLISTED");

        updateStatus(admin, waitingReg, "CONFIRMED")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CAPACITY_EXCEEDED"));

        mockMvc.perform(get("/events/{eventId}/registrations/stats", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(admin)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counts.ATTENDED").value(1))
                .andExpect(jsonPath("$.counts.CONFIRMED").value(0))
                .andExpect(jsonPath("$.counts.WAITLISTED").value(2));
    }

    @Test
    void promotionFollowsArrivalOrderEvenWhenClockStepsBack() throws Exception {
        Event event = testEventFactory.createPublishedEvent("Clock Skew Lab", 1);
        CampusUser holder = testUserFactory.createStudent("holder");
        CampusUser firstInLine = testUserFactory.createStudent("firstq");
        CampusUser secondInLine = testUserFactory.createStudent("secondq");

        long holderReg = register(holder, event, "CONFIRMED");
        long firstReg = register(firstInLine, event, "WAITLISTED");
        long secondReg = register(secondInLine, event, "WAITLISTED");

        Registration first = registrationRepository.findById(firstReg).orElseThrow();
        Registration second = registrationRepository.findById(secondReg).orElseThrow();
        second.setRegisteredAt(first.getRegisteredAt().minusMinutes(5));
        registrationRepository.saveAndFlush(second);

        mockMvc.perform(delete("/events/{eventId}/registrations/{registrationId}", event.getId(), holderReg)
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(holder)))
                .andExpect(status().isOk());

        assertThat(registrationRepository.findById(firstReg).orElseThrow().getStatus())
                .isEqualTo(RegistrationStatus.CONFIRMED);
        assertThat(registrationRepository.findById(secondReg).orElseThrow().getStatus())
                .isEqualTo(RegistrationStatus.WAITLISTED);
    }

    private long register(CampusUser user, Event event, String expectedStatus) throws Exception {
        MvcResult result = mockMvc.perform(post("/events/{eventId}/registrations", event.getId())
                        .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(user)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.regStatus").value(expectedStatus))
                .andExpect(jsonPath("$.eventId").value(event.getId()))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(body.path("userId").asLong()).isEqualTo(user.getId());
        return body.path("regId").asLong();
    }

    private ResultActions updateStatus(
            CampusUser actor,
            long registrationId,
            String status
    ) throws Exception {
        return mockMvc.perform(put("/registrations/{registrationId}", registrationId)
                .header(HttpHeaders.AUTHORIZATION, testUserFactory.bearer(actor))
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                        {"status": "%s"}
                        """.formatted(status)));
    }
}
