package com.washdispatch.service;

import com.washdispatch.dto.FeeBreakdown;
import com.washdispatch.dto.PaymentSucceededEvent;
import com.washdispatch.model.Company;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import com.washdispatch.repository.CompanyRepository;
import com.washdispatch.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Maps "payment succeeded" onto the job exactly once, however often the provider delivers it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentReconciliationService {

    private final JobRepository jobRepository;
    private final CompanyRepository companyRepository;
    private final JobLifecycleService jobLifecycleService;
    private final DispatchService dispatchService;
    private final FinancialLedgerService ledger;
    private final FeeCalculator feeCalculator;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Transactional
    public ReconciliationResult reconcile(PaymentSucceededEvent event) {
        Optional<Job> locked = jobRepository.findByPaymentReferenceForUpdate(event.getPaymentReference());
        if (locked.isEmpty()) {
            log.warn("Payment {} ({}) does not belong to any job", event.getPaymentReference(), event.getSource());
            return ReconciliationResult.unknownPayment();
        }

        Job job = locked.get();
        if (job.getStatus() != JobStatus.PENDING_PAYMENT) {
            log.info("Payment {} for job {} already processed (status {}), ignoring {} delivery",
                    event.getPaymentReference(), job.getId(), job.getStatus(), event.getSource());
            return ReconciliationResult.alreadyProcessed(job.getId(), job.getStatus());
        }

        Instant now = clock.instant();

        if (event.getTipAmount() != null && event.getTipAmount().compareTo(job.getTipAmount()) != 0) {
            job.setTipAmount(event.getTipAmount());
        }
        FeeBreakdown fees = feesFor(job);
        job.setTotalAmount(fees.getTotalAmount());

        Long requested = event.getRequestedCleanerId() != null ? event.getRequestedCleanerId() : job.getRequestedCleanerId();
        boolean direct = dispatchService.resolveDirectAssignment(job, requested, now);

        ledger.getOrCreateFinancials(job, fees, now);
        ledger.recordPaymentCredit(job);
        jobLifecycleService.assignReceiptIfAbsent(job);

        events.publishEvent(JobNotification.of(direct ? JobEventType.JOB_ASSIGNED : JobEventType.JOB_PAID, job));
        log.info("Payment {} reconciled: job {} is {} ({})", event.getPaymentReference(), job.getId(),
                job.getStatus(), event.getSource());
        return ReconciliationResult.reconciled(job.getId(), job.getStatus());
    }

    private FeeBreakdown feesFor(Job job) {
        Company company = companyRepository.findById(job.getCompanyId()).orElse(null);
        if (company == null) {
            log.warn("Company {} of job {} not found, using default fee configuration", job.getCompanyId(), job.getId());
            return feeCalculator.computeFees(job.getBasePrice(), job.getTipAmount(), null, null);
        }
        return feeCalculator.computeFees(job.getBasePrice(), job.getTipAmount(),
                company.getPlatformFee(), company.getFeePackageType());
    }
}
