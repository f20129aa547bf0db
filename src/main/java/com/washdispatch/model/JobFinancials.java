package com.washdispatch.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fee / tax / revenue snapshot taken the first time a job's payment succeeds.
 * One row per job (unique job_id); only refundedAt and cleanerId change afterwards.
 */
@Entity
@Getter
@Setter
@Table(
        name = "job_financials",
        uniqueConstraints = @UniqueConstraint(name = "uk_job_financials_job", columnNames = "job_id")
)
public class JobFinancials {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "cleaner_id")
    private Long cleanerId;

    @Column(name = "base_job_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal baseJobAmount;

    @Column(name = "base_tax", nullable = false, precision = 10, scale = 2)
    private BigDecimal baseTax;

    @Column(name = "tip_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal tipAmount;

    @Column(name = "tip_tax", nullable = false, precision = 10, scale = 2)
    private BigDecimal tipTax;

    @Column(name = "platform_fee_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformFeeAmount;

    @Column(name = "platform_fee_tax", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformFeeTax;

    @Column(name = "payment_processing_fee_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal paymentProcessingFeeAmount;

    @Column(name = "gross_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal grossAmount;

    @Column(name = "net_payable_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal netPayableAmount;

    @Column(name = "tax_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "platform_revenue", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformRevenue;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "AED";

    @Column(name = "paid_at", nullable = false)
    private Instant paidAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
