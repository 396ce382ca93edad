package com.campushub.backend.modules.registration.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.campushub.backend.modules.registration.domain.Registration;
import com.campushub.backend.modules.registration.domain.RegistrationStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RegistrationRepository extends JpaRepository<Registration, Long> {

    /**
     * 엔터티를 영속성 컨텍스트에 올리지 않고 신청의 행사 ID만 읽는다.
     */
    @Query("select r.event.id from Registration r where r.id = :id")
    Optional<Long> findEventIdById(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from Registration r where r.id = :id")
    Optional<Registration> findByIdForUpdate(@Param("id") Long id);

    @Query("select count(r) from Registration r where r.event.id = :eventId and r.status = :status")
    long countByEventIdAndStatus(@Param("eventId") Long eventId, @Param("status") RegistrationStatus status);

    /**
     * 행사 정원을 차지한 신청 수(CONFIRMED, ATTENDED).
     */
    @Query("""
            select count(r)
              from Registration r
             where r.event.id = :eventId
               and r.status in (
                   com.campushub.backend.modules.registration.domain.RegistrationStatus.CONFIRMED,
                   com.campushub.backend.modules.registration.domain.RegistrationStatus.ATTENDED)
            """)
    long countOccupiedSlots(@Param("eventId") Long eventId);

    /**
     * 대기열의 맨 앞 신청. ID는 행사 잠금 안에서 발급되므로 ID 순서가 곧 도착 순서다.
     */
    Optional<Registration> findFirstByEventIdAndStatusOrderByIdAsc(Long eventId, RegistrationStatus status);

    @Query("""
            select case when count(r) > 0 then true else false end
              from Registration r
             where r.user.id = :userId
               and r.event.id = :eventId
               and r.status <> com.campushub.backend.modules.registration.domain.RegistrationStatus.CANCELLED
            """)
    boolean existsActive(@Param("userId") Long userId, @Param("eventId") Long eventId);

    boolean existsByEventId(Long eventId);

    @Query("""
            select r.status as status, count(r) as total
              from Registration r
             where r.event.id = :eventId
             group by r.status
            """)
    List<StatusCountProjection> countByStatus(@Param("eventId") Long eventId);

    @Query("""
            select r.event.id as eventId, count(r) as confirmedCount
              from Registration r
             where r.event.id in :eventIds
               and r.status = com.campushub.backend.modules.registration.domain.RegistrationStatus.CONFIRMED
             group by r.event.id
            """)
    List<ConfirmedCountProjection> countConfirmedByEventIds(@Param("eventIds") Collection<Long> eventIds);

    @Query("""
            select r
              from Registration r
              join fetch r.user u
             where r.event.id = :eventId
             order by r.registeredAt desc, r.id desc
            """)
    List<Registration> findByEventIdWithUser(@Param("eventId") Long eventId);

    @Query("""
            select r
              from Registration r
              join fetch r.event e
             where r.user.id = :userId
             order by r.registeredAt desc, r.id desc
            """)
    List<Registration> findByUserIdWithEvent(@Param("userId") Long userId);

    interface StatusCountProjection {

        RegistrationStatus getStatus();

        long getTotal();
    }

    interface ConfirmedCountProjection {

        Long getEventId();

        long getConfirmedCount();
    }
}
