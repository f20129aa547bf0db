package com.washdispatch.dto;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
public class GeofenceAssignmentRequest {
    private boolean assignAll;
    private List<Long> geofenceIds = new ArrayList<>();
}
