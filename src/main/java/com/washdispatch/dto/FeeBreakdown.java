package com.washdispatch.dto;

import com.washdispatch.model.FeePackageType;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Result of FeeCalculator#computeFees; every amount is already rounded to 2 decimals.
 */
@Getter
@Builder
public class FeeBreakdown {
    private final FeePackageType packageType;
    private final BigDecimal baseAmount;
    private final BigDecimal baseTax;
    private final BigDecimal tipAmount;
    private final BigDecimal tipTax;
    private final BigDecimal platformFee;
    private final BigDecimal platformFeeTax;
    private final BigDecimal taxAmount;
    private final BigDecimal platformRevenue;
    private final BigDecimal platformFeeToCompany;
    private final BigDecimal totalAmount;
    private final BigDecimal processingFee;
    private final BigDecimal grossAmount;
    private final BigDecimal netPayable;
}
