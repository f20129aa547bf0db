package com.washdispatch.repository;

import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CleanerRepository extends JpaRepository<Cleaner, Long> {

    // Always taken after the job row lock
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Cleaner c where c.id = :id")
    Optional<Cleaner> findByIdForUpdate(@Param("id") Long id);

    Optional<Cleaner> findByEmailIgnoreCase(String email);

    List<Cleaner> findByCompanyIdAndStatusAndActiveTrue(Long companyId, CleanerStatus status);

    List<Cleaner> findByCompanyId(Long companyId);

    @Query("select c.id from Cleaner c where c.status = :status and c.active = true "
            + "and (c.lastLocationUpdate is null or c.lastLocationUpdate < :cutoff)")
    List<Long> findIdsWithStaleLocation(@Param("status") CleanerStatus status, @Param("cutoff") Instant cutoff);
}
