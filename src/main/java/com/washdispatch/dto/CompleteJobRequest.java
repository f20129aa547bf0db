package com.washdispatch.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CompleteJobRequest {
    @NotBlank
    private String proofPhotoUrl;
}
