package com.washdispatch.controller;

import com.washdispatch.dto.CleanerStatusRequest;
import com.washdispatch.dto.JobView;
import com.washdispatch.dto.LocationUpdateRequest;
import com.washdispatch.model.Cleaner;
import com.washdispatch.repository.JobRepository;
import com.washdispatch.service.CleanerService;
import com.washdispatch.service.DispatchService;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cleaner")
public class CleanerController {

    private final CleanerService cleanerService;
    private final DispatchService dispatchService;
    private final JobRepository jobRepository;

    public CleanerController(CleanerService cleanerService,
                             DispatchService dispatchService,
                             JobRepository jobRepository) {
        this.cleanerService = cleanerService;
        this.dispatchService = dispatchService;
        this.jobRepository = jobRepository;
    }

    // eligibility is evaluated on every call
    @GetMapping("/available-jobs")
    public List<JobView> availableJobs(Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        return dispatchService.availableJobsFor(cleaner).stream().map(JobView::from).toList();
    }

    @GetMapping("/my-jobs")
    public List<JobView> myJobs(Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        return jobRepository.findByCleanerIdOrderByCreatedAtDesc(cleaner.getId()).stream().map(JobView::from).toList();
    }

    @PostMapping("/status")
    public Map<String, Object> updateStatus(@Valid @RequestBody CleanerStatusRequest request,
                                            Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        Cleaner updated = cleanerService.updateStatus(cleaner.getId(), request.getStatus());
        return Map.of("cleanerId", updated.getId(), "status", updated.getStatus());
    }

    @PostMapping("/location")
    public Map<String, Object> updateLocation(@Valid @RequestBody LocationUpdateRequest request,
                                              Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        Cleaner updated = cleanerService.updateLocation(cleaner.getId(), request.getLatitude(), request.getLongitude());
        return Map.of(
                "cleanerId", updated.getId(),
                "latitude", updated.getCurrentLatitude(),
                "longitude", updated.getCurrentLongitude()
        );
    }
}
