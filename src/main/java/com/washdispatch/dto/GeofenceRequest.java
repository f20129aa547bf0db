package com.washdispatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
public class GeofenceRequest {
    @NotBlank
    private String name;

    // [[lat, lng], ...]
    @NotNull
    @Size(min = 3)
    private List<double[]> polygon;
}
