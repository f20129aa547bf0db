package com.washdispatch.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
public class CreateJobRequest {

    @NotNull
    private Long companyId;

    private Long customerId;

    @Email
    private String customerEmail;

    private String customerPhone;

    @NotBlank
    private String carPlateNumber;

    private String parkingNumber;

    @NotNull
    @DecimalMin("-90.0")
    @DecimalMax("90.0")
    private Double latitude;

    @NotNull
    @DecimalMin("-180.0")
    @DecimalMax("180.0")
    private Double longitude;

    @NotBlank
    private String address;

    @NotNull
    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal basePrice;

    @DecimalMin("0.0")
    private BigDecimal tipAmount;

    // set for direct mode; the job falls back to the pool if this cleaner cannot take it
    private Long requestedCleanerId;
}
