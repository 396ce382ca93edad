package com.campushub.backend.modules.event.presentation.dto;

import com.campushub.backend.modules.event.domain.Branch;

public record BranchResponse(Long id, String code, String name) {

    public static BranchResponse from(Branch branch) {
        return new BranchResponse(branch.getId(), branch.getCode(), branch.getName());
    }
}
