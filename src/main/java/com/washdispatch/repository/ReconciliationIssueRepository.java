package com.washdispatch.repository;

import com.washdispatch.model.ReconciliationIssue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReconciliationIssueRepository extends JpaRepository<ReconciliationIssue, Long> {
    List<ReconciliationIssue> findByResolvedAtIsNullOrderByCreatedAtAsc();

    List<ReconciliationIssue> findByJobId(Long jobId);
}
