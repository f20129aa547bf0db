package com.washdispatch.repository;

import com.washdispatch.model.CleanerGeofenceAssignment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CleanerGeofenceAssignmentRepository extends JpaRepository<CleanerGeofenceAssignment, Long> {
    List<CleanerGeofenceAssignment> findByCleanerId(Long cleanerId);

    void deleteByCleanerId(Long cleanerId);
}
