package com.washdispatch.repository;

import com.washdispatch.model.Job;
import com.washdispatch.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface JobRepository extends JpaRepository<Job, Long> {

    /** SELECT ... FOR UPDATE on the job row; every status transition goes through here. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from Job j where j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from Job j where j.paymentReference = :paymentReference")
    Optional<Job> findByPaymentReferenceForUpdate(@Param("paymentReference") String paymentReference);

    Optional<Job> findByPaymentReference(String paymentReference);

    // Expiry sweep candidates (ids only, rows are re-checked under lock)
    @Query("select j.id from Job j where j.status = :status and j.createdAt < :cutoff order by j.createdAt asc")
    List<Long> findIdsByStatusCreatedBefore(@Param("status") JobStatus status, @Param("cutoff") Instant cutoff);

    // Pool jobs visible to a company's cleaners
    List<Job> findByCompanyIdAndStatusAndCleanerIdIsNullOrderByCreatedAtAsc(Long companyId, JobStatus status);

    List<Job> findByCleanerIdOrderByCreatedAtDesc(Long cleanerId);

    List<Job> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    // Derived "current job" view of a cleaner
    List<Job> findByCleanerIdAndStatusIn(Long cleanerId, Collection<JobStatus> statuses);

    @Modifying(flushAutomatically = true)
    @Query("update Job j set j.receiptNumber = :receiptNumber, j.receiptGeneratedAt = :generatedAt " +
            "where j.id = :id and j.receiptNumber is null")
    int setReceiptIfAbsent(@Param("id") Long id,
                           @Param("receiptNumber") String receiptNumber,
                           @Param("generatedAt") Instant generatedAt);

    @Modifying(flushAutomatically = true)
    @Query("update Job j set j.refundReference = :refundReference, j.refundedAt = :refundedAt " +
            "where j.id = :id and j.refundReference is null")
    int setRefundReferenceIfAbsent(@Param("id") Long id,
                                   @Param("refundReference") String refundReference,
                                   @Param("refundedAt") Instant refundedAt);
}
