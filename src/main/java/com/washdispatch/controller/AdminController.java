package com.washdispatch.controller;

import com.washdispatch.dto.JobView;
import com.washdispatch.dto.ReasonRequest;
import com.washdispatch.model.ReconciliationIssue;
import com.washdispatch.service.JobLifecycleService;
import com.washdispatch.service.ReconciliationIssueService;
import com.washdispatch.service.RefundService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final RefundService refundService;
    private final JobLifecycleService jobLifecycleService;
    private final ReconciliationIssueService issueService;

    public AdminController(RefundService refundService,
                           JobLifecycleService jobLifecycleService,
                           ReconciliationIssueService issueService) {
        this.refundService = refundService;
        this.jobLifecycleService = jobLifecycleService;
        this.issueService = issueService;
    }

    // ---------------- Jobs ----------------
    @PostMapping("/jobs/{id}/refund")
    public JobView refundJob(@PathVariable Long id, @Valid @RequestBody ReasonRequest request) {
        return JobView.from(refundService.refundJob(id, request.getReason()));
    }

    @PostMapping("/jobs/{id}/cancel")
    public JobView cancelJob(@PathVariable Long id, @Valid @RequestBody ReasonRequest request) {
        return JobView.from(jobLifecycleService.cancelJob(id, request.getReason()));
    }

    // ---------------- Reconciliation queue ----------------
    @GetMapping("/reconciliation-issues")
    public List<ReconciliationIssue> openIssues() {
        return issueService.openIssues();
    }

    @PostMapping("/reconciliation-issues/{id}/resolve")
    public ReconciliationIssue resolveIssue(@PathVariable Long id) {
        return issueService.resolve(id);
    }
}
