package com.washdispatch.service;

import com.washdispatch.exception.ReconciliationIssueNotFoundException;
import com.washdispatch.model.ReconciliationIssue;
import com.washdispatch.model.ReconciliationIssueKind;
import com.washdispatch.repository.ReconciliationIssueRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Operator follow-up queue. Issues are never retried automatically.
 */
@Service
@RequiredArgsConstructor
public class ReconciliationIssueService {

    private static final int MAX_DETAIL = 1000;

    private final ReconciliationIssueRepository issueRepository;
    private final Clock clock;

    @Transactional
    public ReconciliationIssue raise(Long jobId, ReconciliationIssueKind kind, String detail) {
        ReconciliationIssue issue = new ReconciliationIssue();
        issue.setJobId(jobId);
        issue.setKind(kind);
        issue.setDetail(detail != null && detail.length() > MAX_DETAIL ? detail.substring(0, MAX_DETAIL) : detail);
        issue.setCreatedAt(clock.instant());
        return issueRepository.save(issue);
    }

    @Transactional(readOnly = true)
    public List<ReconciliationIssue> openIssues() {
        return issueRepository.findByResolvedAtIsNullOrderByCreatedAtAsc();
    }

    @Transactional
    public ReconciliationIssue resolve(Long issueId) {
        ReconciliationIssue issue = issueRepository.findById(issueId)
                .orElseThrow(() -> new ReconciliationIssueNotFoundException(issueId));
        if (issue.getResolvedAt() == null) {
            issue.setResolvedAt(clock.instant());
        }
        return issue;
    }
}
