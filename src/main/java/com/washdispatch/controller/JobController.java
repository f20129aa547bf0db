package com.washdispatch.controller;

import com.washdispatch.dto.CompleteJobRequest;
import com.washdispatch.dto.CreateJobRequest;
import com.washdispatch.dto.CreateJobResponse;
import com.washdispatch.dto.JobView;
import com.washdispatch.exception.CleanerNotEligibleException;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.Job;
import com.washdispatch.service.BookingService;
import com.washdispatch.service.CleanerService;
import com.washdispatch.service.DispatchService;
import com.washdispatch.service.JobLifecycleService;
import com.washdispatch.service.PaymentConfirmationService;
import com.washdispatch.service.ReconciliationResult;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class JobController {

    static final String JOB_TAKEN = "Job is no longer available";

    private final BookingService bookingService;
    private final JobLifecycleService jobLifecycleService;
    private final PaymentConfirmationService paymentConfirmationService;
    private final DispatchService dispatchService;
    private final CleanerService cleanerService;

    public JobController(BookingService bookingService,
                         JobLifecycleService jobLifecycleService,
                         PaymentConfirmationService paymentConfirmationService,
                         DispatchService dispatchService,
                         CleanerService cleanerService) {
        this.bookingService = bookingService;
        this.jobLifecycleService = jobLifecycleService;
        this.paymentConfirmationService = paymentConfirmationService;
        this.dispatchService = dispatchService;
        this.cleanerService = cleanerService;
    }

    // ---------------- Customer ----------------
    @PostMapping("/jobs")
    public ResponseEntity<CreateJobResponse> createJob(@Valid @RequestBody CreateJobRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(bookingService.createJob(request));
    }

    @GetMapping("/jobs/{id}")
    public JobView getJob(@PathVariable Long id) {
        return JobView.from(jobLifecycleService.getJob(id));
    }

    @GetMapping("/customer/jobs")
    public List<JobView> customerJobs(@RequestParam Long customerId) {
        return bookingService.jobsOfCustomer(customerId).stream().map(JobView::from).toList();
    }

    @PostMapping("/jobs/{id}/confirm-payment")
    public Map<String, Object> confirmPayment(@PathVariable Long id) {
        ReconciliationResult result = paymentConfirmationService.confirmPayment(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jobId", result.getJobId());
        body.put("status", result.getStatus());
        body.put("outcome", result.getOutcome().name().toLowerCase(Locale.ROOT));
        return body;
    }

    // ---------------- Cleaner ----------------
    @PostMapping("/jobs/{id}/accept")
    public ResponseEntity<?> acceptJob(@PathVariable Long id, Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        Job job = jobLifecycleService.getJob(id);

        if (!dispatchService.isEligibleFor(cleaner, job)) {
            throw new CleanerNotEligibleException(cleaner.getId(), id);
        }
        if (!jobLifecycleService.acceptJob(id, cleaner.getId())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", JOB_TAKEN));
        }
        return ResponseEntity.ok(JobView.from(jobLifecycleService.getJob(id)));
    }

    @PostMapping("/jobs/{id}/start")
    public JobView startJob(@PathVariable Long id, Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        return JobView.from(jobLifecycleService.startJob(id, cleaner.getId()));
    }

    @PostMapping("/jobs/{id}/complete")
    public JobView completeJob(@PathVariable Long id,
                               @Valid @RequestBody CompleteJobRequest request,
                               Authentication authentication) {
        Cleaner cleaner = cleanerService.findByEmail(authentication.getName());
        return JobView.from(jobLifecycleService.completeJob(id, cleaner.getId(), request.getProofPhotoUrl()));
    }
}
