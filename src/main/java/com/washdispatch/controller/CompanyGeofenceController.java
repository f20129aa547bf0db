package com.washdispatch.controller;

import com.washdispatch.dto.GeofenceAssignmentRequest;
import com.washdispatch.dto.GeofenceRequest;
import com.washdispatch.model.CleanerGeofenceAssignment;
import com.washdispatch.model.Geofence;
import com.washdispatch.service.AccountUserDetailsService;
import com.washdispatch.service.GeofenceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/company")
public class CompanyGeofenceController {

    private final GeofenceService geofenceService;
    private final AccountUserDetailsService accountService;

    public CompanyGeofenceController(GeofenceService geofenceService, AccountUserDetailsService accountService) {
        this.geofenceService = geofenceService;
        this.accountService = accountService;
    }

    @GetMapping("/geofences")
    public List<Geofence> geofences(Authentication authentication) {
        return geofenceService.geofencesOf(accountService.companyIdOf(authentication.getName()));
    }

    @PostMapping("/geofences")
    @ResponseStatus(HttpStatus.CREATED)
    public Geofence createGeofence(@Valid @RequestBody GeofenceRequest request, Authentication authentication) {
        return geofenceService.createGeofence(accountService.companyIdOf(authentication.getName()), request);
    }

    @PutMapping("/cleaners/{cleanerId}/geofences")
    public List<CleanerGeofenceAssignment> assignGeofences(@PathVariable Long cleanerId,
                                                           @RequestBody GeofenceAssignmentRequest request,
                                                           Authentication authentication) {
        Long companyId = accountService.companyIdOf(authentication.getName());
        return geofenceService.assignGeofences(companyId, cleanerId, request);
    }
}
