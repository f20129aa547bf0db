package com.washdispatch.service;

import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerGeofenceAssignment;
import com.washdispatch.model.Geofence;
import com.washdispatch.repository.CleanerGeofenceAssignmentRepository;
import com.washdispatch.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a cleaner covers a location. Nothing here is cached: assignments and polygons
 * are read fresh on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeofenceMatcher {

    private final CleanerGeofenceAssignmentRepository assignmentRepository;
    private final GeofenceRepository geofenceRepository;

    /**
     * Ray casting over [lat, lng] vertices. Points exactly on an edge may fall either way.
     * Returns false for a missing polygon or one with fewer than 3 vertices.
     */
    public static boolean pointInPolygon(double lat, double lon, List<double[]> polygon) {
        if (polygon == null || polygon.size() < 3) {
            return false;
        }
        boolean inside = false;
        for (int i = 0, j = polygon.size() - 1; i < polygon.size(); j = i++) {
            double[] vi = polygon.get(i);
            double[] vj = polygon.get(j);
            if (!isVertex(vi) || !isVertex(vj)) {
                return false;
            }
            double latI = vi[0], lonI = vi[1];
            double latJ = vj[0], lonJ = vj[1];

            boolean straddles = (lonI > lon) != (lonJ > lon);
            if (straddles && lat < (latJ - latI) * (lon - lonI) / (lonJ - lonI) + latI) {
                inside = !inside;
            }
        }
        return inside;
    }

    private static boolean isVertex(double[] v) {
        return v != null && v.length >= 2;
    }

    /**
     * An assign-all marker wins over explicit polygons. Without any assignment the cleaner is never eligible.
     */
    public boolean isEligible(Cleaner cleaner, Double lat, Double lon) {
        if (cleaner == null || lat == null || lon == null) {
            return false;
        }

        List<CleanerGeofenceAssignment> assignments = assignmentRepository.findByCleanerId(cleaner.getId());
        if (assignments.isEmpty()) {
            return false;
        }
        if (assignments.stream().anyMatch(CleanerGeofenceAssignment::isAssignAll)) {
            return true;
        }

        List<Long> geofenceIds = assignments.stream()
                .map(CleanerGeofenceAssignment::getGeofenceId)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
        if (geofenceIds.isEmpty()) {
            return false;
        }

        for (Geofence fence : geofenceRepository.findByCompanyIdAndIdIn(cleaner.getCompanyId(), geofenceIds)) {
            List<double[]> polygon = fence.getPolygon();
            if (polygon == null || polygon.size() < 3 || !polygon.stream().allMatch(GeofenceMatcher::isVertex)) {
                log.warn("Geofence {} ('{}') of company {} has a malformed polygon, skipped",
                        fence.getId(), fence.getName(), fence.getCompanyId());
                continue;
            }
            if (pointInPolygon(lat, lon, polygon)) {
                return true;
            }
        }
        return false;
    }
}
