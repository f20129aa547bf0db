package com.washdispatch.service;

import com.washdispatch.dto.FeeBreakdown;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobFinancials;
import com.washdispatch.model.LedgerTransaction;
import com.washdispatch.model.TransactionDirection;
import com.washdispatch.model.TransactionType;
import com.washdispatch.repository.JobFinancialsRepository;
import com.washdispatch.repository.LedgerTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Financial record and money-movement rows. Always called from inside a job transition,
 * so the job row lock already serialises writers for one job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FinancialLedgerService {

    private final JobFinancialsRepository financialsRepository;
    private final LedgerTransactionRepository transactionRepository;
    private final ReferenceNumberGenerator referenceNumbers;
    private final Clock clock;

    /** Get-or-create keyed on the job id; an existing record is returned untouched. */
    @Transactional
    public JobFinancials getOrCreateFinancials(Job job, FeeBreakdown fees, Instant paidAt) {
        return financialsRepository.findByJobId(job.getId())
                .orElseGet(() -> financialsRepository.save(newFinancials(job, fees, paidAt)));
    }

    private JobFinancials newFinancials(Job job, FeeBreakdown fees, Instant paidAt) {
        JobFinancials f = new JobFinancials();
        f.setJobId(job.getId());
        f.setCompanyId(job.getCompanyId());
        f.setCleanerId(job.getCleanerId());
        f.setBaseJobAmount(fees.getBaseAmount());
        f.setBaseTax(fees.getBaseTax());
        f.setTipAmount(fees.getTipAmount());
        f.setTipTax(fees.getTipTax());
        f.setPlatformFeeAmount(fees.getPlatformFee());
        f.setPlatformFeeTax(fees.getPlatformFeeTax());
        f.setPaymentProcessingFeeAmount(fees.getProcessingFee());
        f.setGrossAmount(fees.getGrossAmount());
        f.setNetPayableAmount(fees.getNetPayable());
        f.setTaxAmount(fees.getTaxAmount());
        f.setPlatformRevenue(fees.getPlatformRevenue());
        f.setCurrency(job.getCurrency());
        f.setPaidAt(paidAt);
        f.setCreatedAt(clock.instant());
        log.debug("Financial record created for job {}: total {} net {}", job.getId(),
                fees.getTotalAmount(), fees.getNetPayable());
        return f;
    }

    @Transactional
    public void assignCleaner(Long jobId, Long cleanerId) {
        financialsRepository.findByJobId(jobId).ifPresent(f -> f.setCleanerId(cleanerId));
    }

    @Transactional
    public void markRefunded(Long jobId, Instant refundedAt) {
        financialsRepository.findByJobId(jobId).ifPresent(f -> {
            if (f.getRefundedAt() == null) {
                f.setRefundedAt(refundedAt);
            }
        });
    }

    /** CREDIT row for the customer payment; written once per job. */
    @Transactional
    public LedgerTransaction recordPaymentCredit(Job job) {
        return transactionRepository.findByJobIdAndDirection(job.getId(), TransactionDirection.CREDIT).stream()
                .findFirst()
                .orElseGet(() -> {
                    LedgerTransaction tx = newTransaction(job, TransactionType.CUSTOMER_PAYMENT, TransactionDirection.CREDIT);
                    tx.setDescription("Customer payment for job #" + job.getId());
                    return transactionRepository.save(tx);
                });
    }

    @Transactional
    public LedgerTransaction recordRefundDebit(Job job, String refundReference) {
        LedgerTransaction tx = newTransaction(job, TransactionType.REFUND, TransactionDirection.DEBIT);
        tx.setRefundReference(refundReference);
        tx.setDescription("Refund for job #" + job.getId()
                + (job.getRefundReason() == null ? "" : ": " + job.getRefundReason()));
        return transactionRepository.save(tx);
    }

    private LedgerTransaction newTransaction(Job job, TransactionType type, TransactionDirection direction) {
        LedgerTransaction tx = new LedgerTransaction();
        tx.setReferenceNumber(referenceNumbers.transactionReference(type, job.getId()));
        tx.setType(type);
        tx.setDirection(direction);
        tx.setJobId(job.getId());
        tx.setCompanyId(job.getCompanyId());
        tx.setAmount(job.getTotalAmount());
        tx.setCurrency(job.getCurrency());
        tx.setPaymentReference(job.getPaymentReference());
        tx.setCreatedAt(clock.instant());
        return tx;
    }
}
