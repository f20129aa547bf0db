package com.washdispatch.repository;

import com.washdispatch.model.JobFinancials;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JobFinancialsRepository extends JpaRepository<JobFinancials, Long> {
    Optional<JobFinancials> findByJobId(Long jobId);

    long countByJobId(Long jobId);
}
