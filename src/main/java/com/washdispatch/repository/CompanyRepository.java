package com.washdispatch.repository;

import com.washdispatch.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CompanyRepository extends JpaRepository<Company, Long> {

    // in-place increment, several cleaners of one company complete concurrently
    @Modifying(flushAutomatically = true)
    @Query("update Company c set c.totalJobsCompleted = c.totalJobsCompleted + 1 where c.id = :id")
    int incrementJobsCompleted(@Param("id") Long id);
}
