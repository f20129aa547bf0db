package com.washdispatch.service;

import com.washdispatch.dto.FeeBreakdown;
import com.washdispatch.model.FeePackageType;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pure fee arithmetic for one job. Every intermediate amount is rounded HALF_UP to 2 decimals
 * before it feeds the next step, so stored components always add up to the stored totals.
 */
@Service
public class FeeCalculator {

    // --- Tax ---
    private static final BigDecimal TAX_RATE = bd("0.05");

    // --- Platform fee split ---
    private static final BigDecimal PLATFORM_SHARE = bd("0.05");
    private static final BigDecimal COMPANY_SHARE  = bd("0.95");

    // --- Package 1: fixed + percentage of the wash price ---
    private static final BigDecimal PACKAGE1_FIXED = bd("2.00");
    private static final BigDecimal PACKAGE1_RATE  = bd("0.05");

    // --- Card processing (charged on the customer total) ---
    private static final BigDecimal PROCESSING_RATE  = bd("0.029");
    private static final BigDecimal PROCESSING_FIXED = bd("1.00");

    private static BigDecimal bd(String v) { return new BigDecimal(v); }

    private static BigDecimal r(BigDecimal v) { return v.setScale(2, RoundingMode.HALF_UP); }

    private static BigDecimal nz(BigDecimal v) { return v == null ? BigDecimal.ZERO : v; }

    /** Platform fee before tax for the given package. Only CUSTOM uses the configured amount. */
    public BigDecimal platformFeeFor(BigDecimal baseAmount, BigDecimal configuredFee, FeePackageType packageType) {
        FeePackageType type = packageType == null ? FeePackageType.CUSTOM : packageType;
        return switch (type) {
            case CUSTOM -> r(nz(configuredFee));
            case PACKAGE1 -> r(PACKAGE1_FIXED.add(nz(baseAmount).multiply(PACKAGE1_RATE)));
            case PACKAGE2 -> r(BigDecimal.ZERO);
        };
    }

    public FeeBreakdown computeFees(BigDecimal baseAmount,
                                    BigDecimal tipAmount,
                                    BigDecimal platformFee,
                                    FeePackageType packageType) {
        BigDecimal base = r(nz(baseAmount));
        BigDecimal tip = r(nz(tipAmount));
        if (base.signum() < 0 || tip.signum() < 0) {
            throw new IllegalArgumentException("Amounts must not be negative");
        }

        BigDecimal fee = platformFeeFor(base, platformFee, packageType);

        BigDecimal baseTax = r(base.multiply(TAX_RATE));
        BigDecimal tipTax = r(tip.multiply(TAX_RATE));
        BigDecimal feeTax = r(fee.multiply(TAX_RATE));
        BigDecimal taxAmount = r(baseTax.add(tipTax).add(feeTax));

        BigDecimal platformRevenue = r(fee.multiply(PLATFORM_SHARE));
        BigDecimal platformFeeToCompany = r(fee.multiply(COMPANY_SHARE));

        BigDecimal total = r(base.add(baseTax).add(tip).add(tipTax).add(fee).add(feeTax));
        BigDecimal processingFee = r(total.multiply(PROCESSING_RATE).add(PROCESSING_FIXED));
        BigDecimal gross = r(total.add(processingFee));
        BigDecimal netPayable = r(gross.subtract(fee).subtract(feeTax).subtract(processingFee));

        return FeeBreakdown.builder()
                .packageType(packageType == null ? FeePackageType.CUSTOM : packageType)
                .baseAmount(base)
                .baseTax(baseTax)
                .tipAmount(tip)
                .tipTax(tipTax)
                .platformFee(fee)
                .platformFeeTax(feeTax)
                .taxAmount(taxAmount)
                .platformRevenue(platformRevenue)
                .platformFeeToCompany(platformFeeToCompany)
                .totalAmount(total)
                .processingFee(processingFee)
                .grossAmount(gross)
                .netPayable(netPayable)
                .build();
    }
}
