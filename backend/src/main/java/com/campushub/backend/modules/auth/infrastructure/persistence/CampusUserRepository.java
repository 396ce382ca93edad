package com.campushub.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;

import com.campushub.backend.modules.auth.domain.CampusUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CampusUserRepository extends JpaRepository<CampusUser, Long> {

    @Query("select cu from CampusUser cu where lower(cu.email) = lower(:email)")
    Optional<CampusUser> findByEmailIgnoreCase(@Param("email") String email);

    boolean existsByEmail(String email);

    boolean existsByStudentId(String studentId);

    boolean existsByUsername(String username);

    @Query("""
            select case when count(ur) > 0 then true else false end
              from UserRole ur
             where ur.user.id = :userId
               and ur.revokedAt is null
               and upper(ur.role.code) = 'ADMIN'
            """)
    boolean existsActiveAdminRole(@Param("userId") Long userId);
}
