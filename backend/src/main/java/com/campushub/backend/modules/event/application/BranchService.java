package com.campushub.backend.modules.event.application;

import java.util.List;

import com.campushub.backend.modules.event.infrastructure.persistence.BranchRepository;
import com.campushub.backend.modules.event.presentation.dto.BranchResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class BranchService {

    private final BranchRepository branchRepository;

    public BranchService(BranchRepository branchRepository) {
        this.branchRepository = branchRepository;
    }

    public List<BranchResponse> listBranches() {
        return branchRepository.findAllByOrderByNameAsc().stream()
                .map(BranchResponse::from)
                .toList();
    }
}
