package com.washdispatch.repository;

import com.washdispatch.model.LedgerTransaction;
import com.washdispatch.model.TransactionDirection;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, Long> {
    List<LedgerTransaction> findByJobIdOrderByCreatedAtAsc(Long jobId);

    List<LedgerTransaction> findByJobIdAndDirection(Long jobId, TransactionDirection direction);
}
