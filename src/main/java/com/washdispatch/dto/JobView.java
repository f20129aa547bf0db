package com.washdispatch.dto;

import com.washdispatch.model.AssignmentMode;
import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable read model of a job, safe to hand to other threads after the transaction closed.
 */
@Getter
@Builder
public class JobView {
    private final Long id;
    private final JobStatus status;
    private final Long companyId;
    private final Long cleanerId;
    private final Long customerId;
    private final AssignmentMode assignmentMode;
    private final Long requestedCleanerId;

    private final String carPlateNumber;
    private final String parkingNumber;
    private final Double latitude;
    private final Double longitude;
    private final String address;

    private final BigDecimal basePrice;
    private final BigDecimal tipAmount;
    private final BigDecimal totalAmount;
    private final String currency;
    private final String receiptNumber;
    private final String refundReason;
    private final String proofPhotoUrl;

    private final Instant createdAt;
    private final Instant assignedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant refundedAt;

    public static JobView from(Job job) {
        return JobView.builder()
                .id(job.getId())
                .status(job.getStatus())
                .companyId(job.getCompanyId())
                .cleanerId(job.getCleanerId())
                .customerId(job.getCustomerId())
                .assignmentMode(job.getAssignmentMode())
                .requestedCleanerId(job.getRequestedCleanerId())
                .carPlateNumber(job.getCarPlateNumber())
                .parkingNumber(job.getParkingNumber())
                .latitude(job.getLatitude())
                .longitude(job.getLongitude())
                .address(job.getAddress())
                .basePrice(job.getBasePrice())
                .tipAmount(job.getTipAmount())
                .totalAmount(job.getTotalAmount())
                .currency(job.getCurrency())
                .receiptNumber(job.getReceiptNumber())
                .refundReason(job.getRefundReason())
                .proofPhotoUrl(job.getProofPhotoUrl())
                .createdAt(job.getCreatedAt())
                .assignedAt(job.getAssignedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .refundedAt(job.getRefundedAt())
                .build();
    }
}
