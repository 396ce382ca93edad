package com.campushub.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.campushub.backend.modules.event.domain.Branch;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BranchRepository extends JpaRepository<Branch, Long> {

    List<Branch> findAllByOrderByNameAsc();

    Optional<Branch> findByCode(String code);
}
