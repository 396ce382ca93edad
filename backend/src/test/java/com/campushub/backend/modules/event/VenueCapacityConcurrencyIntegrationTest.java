package com.campushub.backend.modules.event;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.campushub.backend.global.error.ProblemException;
import com.campushub.backend.modules.event.application.EventService;
import com.campushub.backend.modules.event.application.VenueService;
import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.domain.EventStatus;
import com.campushub.backend.modules.event.domain.Venue;
import com.campushub.backend.modules.event.infrastructure.persistence.EventRepository;
import com.campushub.backend.modules.event.infrastructure.persistence.VenueRepository;
import com.campushub.backend.modules.event.presentation.dto.UpdateEventRequest;
import com.campushub.backend.modules.event.presentation.dto.UpdateVenueRequest;
import com.campushub.backend.support.AbstractPostgresIntegrationTest;
import com.campushub.backend.support.TestEventFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class VenueCapacityConcurrencyIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final int ROUNDS = 10;

    @Autowired
    private EventService eventService;

    @Autowired
    private VenueService venueService;

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private VenueRepository venueRepository;

    @Autowired
    private TestEventFactory testEventFactory;

    @Test
    void shrinkingVenueAndGrowingEventNeverBothSucceed() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            Venue venue = testEventFactory.createVenue("Seminar Hall " + round, 30);
            Event event = testEventFactory.createEvent("Study Jam " + round, 10, false, EventStatus.DRAFT, venue);

            List<Future<Object>> futures = submitTogether(List.of(
                    () -> venueService.updateVenue(venue.getId(), new UpdateVenueRequest(null, null, 15)),
                    () -> eventService.updateEvent(event.getId(),
                            new UpdateEventRequest(null, null, null, null, 25, null, null, null))
            ));

            int succeeded = 0;
            for (Future<Object> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(ProblemException.class);
                    assertThat(((ProblemException) ex.getCause()).getCode())
                            .isIn("VENUE_CAPACITY_CONFLICT", "INVALID_MAX_SLOTS");
                }
            }

            int capacity = venueRepository.findById(venue.getId()).orElseThrow().getCapacity();
            int maxSlots = eventRepository.findById(event.getId()).orElseThrow().getMaxSlots();
            assertThat(succeeded).isEqualTo(1);
            assertThat(maxSlots).isLessThanOrEqualTo(capacity);
        }
    }

    private List<Future<Object>> submitTogether(List<Callable<Object>> tasks) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (Callable<Object> task : tasks) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            return futures;
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
        }
    }
}
