package com.washdispatch.dto;

import com.washdispatch.model.CleanerStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CleanerStatusRequest {
    @NotNull
    private CleanerStatus status;
}
