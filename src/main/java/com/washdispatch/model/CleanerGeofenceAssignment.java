package com.washdispatch.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Either one row per assigned geofence, or a single row with assignAll=true
 * meaning the cleaner covers every geofence of the company.
 */
@Entity
@Table(name = "cleaner_geofence_assignments")
@Getter
@Setter
public class CleanerGeofenceAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "cleaner_id", nullable = false)
    private Long cleanerId;

    @Column(name = "geofence_id")
    private Long geofenceId;   // null when assignAll

    @Column(name = "assign_all", nullable = false)
    private boolean assignAll;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    public static CleanerGeofenceAssignment all(Long companyId, Long cleanerId) {
        CleanerGeofenceAssignment a = new CleanerGeofenceAssignment();
        a.setCompanyId(companyId);
        a.setCleanerId(cleanerId);
        a.setAssignAll(true);
        return a;
    }

    public static CleanerGeofenceAssignment of(Long companyId, Long cleanerId, Long geofenceId) {
        CleanerGeofenceAssignment a = new CleanerGeofenceAssignment();
        a.setCompanyId(companyId);
        a.setCleanerId(cleanerId);
        a.setGeofenceId(geofenceId);
        return a;
    }
}
