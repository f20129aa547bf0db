package com.washdispatch.service;

import com.washdispatch.model.TransactionType;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

@Component
public class ReferenceNumberGenerator {

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final DateTimeFormatter RECEIPT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final ZoneId businessZoneId;

    public ReferenceNumberGenerator(Clock clock, ZoneId businessZoneId) {
        this.clock = clock;
        this.businessZoneId = businessZoneId;
    }

    /** TYPE-jobId-epochMillis-RANDOM6, e.g. REFUND-42-1718000000000-X7K2QP */
    public String transactionReference(TransactionType type, Long jobId) {
        return type.name() + "-" + jobId + "-" + clock.millis() + "-" + randomSuffix(6);
    }

    /** RCP-yyyyMMdd-jobId; one receipt per job so the job id keeps it unique. */
    public String receiptNumber(Long jobId) {
        LocalDate day = LocalDate.ofInstant(clock.instant(), businessZoneId);
        return "RCP-" + day.format(RECEIPT_DATE) + "-" + String.format("%06d", jobId);
    }

    private String randomSuffix(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
