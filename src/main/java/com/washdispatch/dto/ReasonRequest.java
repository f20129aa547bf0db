package com.washdispatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

// body of admin refund / cancel calls
@Getter
@Setter
public class ReasonRequest {
    @NotBlank
    @Size(max = 255)
    private String reason;
}
