package com.washdispatch.service;

import com.washdispatch.dto.JobView;
import com.washdispatch.model.AssignmentMode;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.Job;
import com.washdispatch.repository.CleanerRepository;
import com.washdispatch.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Mail channel: the directly assigned cleaner hears about the job, the customer hears about
 * refunds and completion.
 */
@Component
@RequiredArgsConstructor
public class EmailJobNotifier implements JobNotifier {

    private final EmailService emailService;
    private final CleanerRepository cleanerRepository;
    private final JobRepository jobRepository;

    @Override
    public void notify(JobNotification notification) {
        JobView job = notification.getJob();
        switch (notification.getEvent()) {
            case JOB_ASSIGNED -> {
                if (job.getAssignmentMode() == AssignmentMode.DIRECT && job.getCleanerId() != null) {
                    cleanerRepository.findById(job.getCleanerId()).ifPresent(c -> mailDirectAssignment(c, job));
                }
            }
            case JOB_REFUNDED_UNATTENDED -> mailCustomer(job,
                    "Your car wash was refunded",
                    "No cleaner accepted your job #" + job.getId() + " in time. "
                            + "A full refund of " + job.getTotalAmount() + " " + job.getCurrency()
                            + " has been issued.");
            case JOB_REFUNDED -> mailCustomer(job,
                    "Your car wash was refunded",
                    "Job #" + job.getId() + " has been refunded. Reason: " + job.getRefundReason());
            case JOB_COMPLETED -> mailCustomer(job,
                    "Your car is clean",
                    "Job #" + job.getId() + " for " + job.getCarPlateNumber() + " is complete. "
                            + "Receipt: " + job.getReceiptNumber());
            default -> {
                // no mail for the other events
            }
        }
    }

    private void mailDirectAssignment(Cleaner cleaner, JobView job) {
        emailService.sendEmail(cleaner.getEmail(),
                "New job assigned to you",
                "Job #" + job.getId() + " at " + job.getAddress()
                        + " (plate " + job.getCarPlateNumber() + ") has been assigned to you.");
    }

    private void mailCustomer(JobView view, String subject, String text) {
        String to = jobRepository.findById(view.getId()).map(Job::getCustomerEmail).orElse(null);
        if (to == null || to.isBlank()) {
            return;
        }
        emailService.sendEmail(to, subject, text);
    }
}
