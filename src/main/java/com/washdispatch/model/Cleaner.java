package com.washdispatch.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "cleaners")
@Getter
@Setter
public class Cleaner {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // login identity, matches UserAccount.email
    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CleanerStatus status = CleanerStatus.OFF_DUTY;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "current_latitude")
    private Double currentLatitude;

    @Column(name = "current_longitude")
    private Double currentLongitude;

    @Column(name = "last_location_update")
    private Instant lastLocationUpdate;

    @Column(name = "total_jobs_completed", nullable = false)
    private int totalJobsCompleted;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
