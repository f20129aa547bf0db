package com.washdispatch.service;

import com.washdispatch.dto.GeofenceAssignmentRequest;
import com.washdispatch.dto.GeofenceRequest;
import com.washdispatch.exception.CleanerNotFoundException;
import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerGeofenceAssignment;
import com.washdispatch.model.Geofence;
import com.washdispatch.repository.CleanerGeofenceAssignmentRepository;
import com.washdispatch.repository.CleanerRepository;
import com.washdispatch.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Company admin management of service areas and of which cleaner covers which area.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeofenceService {

    private final GeofenceRepository geofenceRepository;
    private final CleanerGeofenceAssignmentRepository assignmentRepository;
    private final CleanerRepository cleanerRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Geofence> geofencesOf(Long companyId) {
        return geofenceRepository.findByCompanyIdOrderByNameAsc(companyId);
    }

    @Transactional
    public Geofence createGeofence(Long companyId, GeofenceRequest request) {
        List<double[]> polygon = request.getPolygon();
        if (polygon == null || polygon.size() < 3) {
            throw new IllegalArgumentException("A geofence needs at least 3 vertices");
        }
        List<double[]> vertices = new ArrayList<>();
        for (double[] v : polygon) {
            if (v == null || v.length != 2 || Math.abs(v[0]) > 90 || Math.abs(v[1]) > 180) {
                throw new IllegalArgumentException("Each vertex must be a [lat, lng] pair");
            }
            vertices.add(new double[]{v[0], v[1]});
        }

        Geofence fence = new Geofence();
        fence.setCompanyId(companyId);
        fence.setName(request.getName().trim());
        fence.setPolygon(vertices);
        fence.setCreatedAt(clock.instant());
        geofenceRepository.save(fence);
        log.info("Geofence {} '{}' created for company {}", fence.getId(), fence.getName(), companyId);
        return fence;
    }

    /**
     * Replaces the cleaner's coverage. assignAll stores the single "all" marker and ignores the ids.
     */
    @Transactional
    public List<CleanerGeofenceAssignment> assignGeofences(Long companyId, Long cleanerId, GeofenceAssignmentRequest request) {
        Cleaner cleaner = cleanerRepository.findById(cleanerId)
                .filter(c -> Objects.equals(c.getCompanyId(), companyId))
                .orElseThrow(() -> new CleanerNotFoundException(cleanerId));

        List<CleanerGeofenceAssignment> assignments = new ArrayList<>();
        if (request.isAssignAll()) {
            assignments.add(CleanerGeofenceAssignment.all(companyId, cleaner.getId()));
        } else {
            Set<Long> ids = new LinkedHashSet<>(request.getGeofenceIds() == null ? List.of() : request.getGeofenceIds());
            ids.remove(null);
            List<Geofence> fences = ids.isEmpty() ? List.of() : geofenceRepository.findByCompanyIdAndIdIn(companyId, ids);
            if (fences.size() != ids.size()) {
                throw new IllegalArgumentException("Unknown geofence for company " + companyId);
            }
            for (Long id : ids) {
                assignments.add(CleanerGeofenceAssignment.of(companyId, cleaner.getId(), id));
            }
        }

        assignmentRepository.deleteByCleanerId(cleaner.getId());
        assignmentRepository.flush();
        assignments.forEach(a -> a.setCreatedAt(clock.instant()));
        List<CleanerGeofenceAssignment> saved = assignmentRepository.saveAll(assignments);
        log.info("Cleaner {} now covers {}", cleanerId, request.isAssignAll() ? "all geofences" : saved.size() + " geofence(s)");
        return saved;
    }
}
