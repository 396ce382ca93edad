package com.campushub.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.campushub.backend.modules.event.domain.Event;
import com.campushub.backend.modules.event.domain.EventStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EventRepository extends JpaRepository<Event, Long> {

    /**
     * 행사의 신청을 읽거나 쓰기 전에 먼저 잡는 행 잠금.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from Event e where e.id = :id")
    Optional<Event> findByIdForUpdate(@Param("id") Long id);

    @Query("select e from Event e join fetch e.venue where e.id = :id")
    Optional<Event> findWithVenueById(@Param("id") Long id);

    @Query("""
            select e
              from Event e
              join fetch e.venue v
             where (:status is null or e.status = :status)
               and (:published is null or e.published = :published)
               and (:venueId is null or v.id = :venueId)
             order by e.startTime desc, e.id desc
            """)
    List<Event> search(
            @Param("status") EventStatus status,
            @Param("published") Boolean published,
            @Param("venueId") Long venueId
    );

    @Query("""
            select case when count(e) > 0 then true else false end
              from Event e
             where e.venue.id = :venueId
               and e.maxSlots > :capacity
            """)
    boolean existsByVenueWithMaxSlotsAbove(@Param("venueId") Long venueId, @Param("capacity") int capacity);
}
