package com.washdispatch.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "companies")
@Getter
@Setter
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "fee_package_type", nullable = false, length = 16)
    private FeePackageType feePackageType = FeePackageType.CUSTOM;

    // only meaningful for CUSTOM
    @Column(name = "platform_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal platformFee = new BigDecimal("3.00");

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "total_jobs_completed", nullable = false)
    private int totalJobsCompleted;
}
