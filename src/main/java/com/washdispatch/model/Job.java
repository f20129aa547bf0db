package com.washdispatch.model;

import com.washdispatch.exception.InvalidJobTransitionException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import org.hibernate.annotations.DynamicUpdate;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "jobs")
@DynamicUpdate
@Getter
@Setter
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // --- Customer / vehicle ---
    @Column(name = "customer_id")
    private Long customerId;

    @Column(name = "customer_email")
    private String customerEmail;

    @Column(name = "customer_phone")
    private String customerPhone;

    @Column(name = "car_plate_number", nullable = false)
    private String carPlateNumber;

    @Column(name = "parking_number")
    private String parkingNumber;

    // --- Location (write-once) ---
    @Setter(AccessLevel.NONE)
    @Column(name = "location_latitude", nullable = false, updatable = false)
    private Double latitude;

    @Setter(AccessLevel.NONE)
    @Column(name = "location_longitude", nullable = false, updatable = false)
    private Double longitude;

    @Column(name = "location_address", nullable = false)
    private String address;

    // --- Commercial ---
    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "tip_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal tipAmount = BigDecimal.ZERO;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "AED";

    @Column(name = "payment_reference", unique = true)
    private String paymentReference;   // provider payment intent id

    @Column(name = "refund_reference")
    private String refundReference;    // set once

    @Column(name = "refund_reason")
    private String refundReason;

    @Column(name = "receipt_number", unique = true, length = 50)
    private String receiptNumber;      // set once, see JobRepository#setReceiptIfAbsent

    @Column(name = "receipt_generated_at")
    private Instant receiptGeneratedAt;

    // --- Assignment ---
    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "cleaner_id")
    private Long cleanerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assignment_mode", nullable = false, length = 16)
    private AssignmentMode assignmentMode = AssignmentMode.POOL;

    @Column(name = "requested_cleaner_id")
    private Long requestedCleanerId;

    @Column(name = "direct_assignment_at")
    private Instant directAssignmentAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.PENDING_PAYMENT;

    // --- Audit ---
    @Column(name = "assigned_at")
    private Instant assignedAt;

    @Column(name = "accepted_at")
    private Instant acceptedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "refunded_at")
    private Instant refundedAt;

    @Column(name = "proof_photo_url")
    private String proofPhotoUrl;

    /**
     * Moves the job along the lifecycle. Callers must hold the row lock.
     */
    public void transitionTo(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidJobTransitionException(id, status, target);
        }
        this.status = target;
    }

    /**
     * Location can be placed exactly once, before the job is first persisted.
     */
    public void placeAt(double latitude, double longitude) {
        if (this.latitude != null || this.longitude != null) {
            throw new IllegalStateException("Job location is immutable once set");
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }
}
