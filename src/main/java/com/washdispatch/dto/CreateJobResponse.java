package com.washdispatch.dto;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class CreateJobResponse {
    private final Long jobId;
    private final String clientSecret;
    private final BigDecimal totalAmount;

    public CreateJobResponse(Long jobId, String clientSecret, BigDecimal totalAmount) {
        this.jobId = jobId;
        this.clientSecret = clientSecret;
        this.totalAmount = totalAmount;
    }
}
