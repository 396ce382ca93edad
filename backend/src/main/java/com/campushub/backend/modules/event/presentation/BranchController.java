package com.campushub.backend.modules.event.presentation;

import java.util.List;

import com.campushub.backend.modules.event.application.BranchService;
import com.campushub.backend.modules.event.presentation.dto.BranchResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BranchController {

    private final BranchService branchService;

    public BranchController(BranchService branchService) {
        this.branchService = branchService;
    }

    @GetMapping("/branches")
    public ResponseEntity<List<BranchResponse>> list() {
        return ResponseEntity.ok(branchService.listBranches());
    }
}
