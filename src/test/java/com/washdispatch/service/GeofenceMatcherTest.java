package com.washdispatch.service;

import com.washdispatch.model.Cleaner;
import com.washdispatch.model.CleanerGeofenceAssignment;
import com.washdispatch.model.Geofence;
import com.washdispatch.repository.CleanerGeofenceAssignmentRepository;
import com.washdispatch.repository.GeofenceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeofenceMatcherTest {

    private static final List<double[]> SQUARE = List.of(
            new double[]{0, 0}, new double[]{0, 10}, new double[]{10, 10}, new double[]{10, 0});

    @Mock CleanerGeofenceAssignmentRepository assignmentRepository;
    @Mock GeofenceRepository geofenceRepository;
    @InjectMocks GeofenceMatcher matcher;

    private Cleaner cleaner;

    @BeforeEach
    void setup() {
        cleaner = new Cleaner();
        cleaner.setId(11L);
        cleaner.setCompanyId(3L);
    }

    private static Geofence fence(long id, List<double[]> polygon) {
        Geofence g = new Geofence();
        g.setId(id);
        g.setCompanyId(3L);
        g.setName("fence-" + id);
        g.setPolygon(polygon);
        return g;
    }

    @Test
    void pointInPolygon_insideAndOutside() {
        assertThat(GeofenceMatcher.pointInPolygon(5, 5, SQUARE)).isTrue();
        assertThat(GeofenceMatcher.pointInPolygon(15, 15, SQUARE)).isFalse();
        assertThat(GeofenceMatcher.pointInPolygon(5, -1, SQUARE)).isFalse();
    }

    @Test
    void pointInPolygon_degeneratePolygonNeverMatches() {
        assertThat(GeofenceMatcher.pointInPolygon(0, 0, List.of(new double[]{0, 0}, new double[]{10, 10}))).isFalse();
        assertThat(GeofenceMatcher.pointInPolygon(0, 0, null)).isFalse();
    }

    @Test
    void assignAllWinsWithoutReadingPolygons() {
        when(assignmentRepository.findByCleanerId(11L))
                .thenReturn(List.of(CleanerGeofenceAssignment.of(3L, 11L, 99L), CleanerGeofenceAssignment.all(3L, 11L)));

        assertThat(matcher.isEligible(cleaner, 50.0, 50.0)).isTrue();
        verify(geofenceRepository, never()).findByCompanyIdAndIdIn(anyLong(), any());
    }

    @Test
    void noAssignmentsMeansNeverEligible() {
        when(assignmentRepository.findByCleanerId(11L)).thenReturn(List.of());

        assertThat(matcher.isEligible(cleaner, 5.0, 5.0)).isFalse();
    }

    @Test
    void explicitFenceDecidesByLocation() {
        when(assignmentRepository.findByCleanerId(11L)).thenReturn(List.of(CleanerGeofenceAssignment.of(3L, 11L, 1L)));
        when(geofenceRepository.findByCompanyIdAndIdIn(eq(3L), any())).thenReturn(List.of(fence(1L, SQUARE)));

        assertThat(matcher.isEligible(cleaner, 5.0, 5.0)).isTrue();
        assertThat(matcher.isEligible(cleaner, 15.0, 15.0)).isFalse();
    }

    @Test
    void malformedFenceIsSkippedAndOthersStillCount() {
        when(assignmentRepository.findByCleanerId(11L)).thenReturn(List.of(
                CleanerGeofenceAssignment.of(3L, 11L, 1L), CleanerGeofenceAssignment.of(3L, 11L, 2L)));
        Geofence broken = fence(1L, List.of(new double[]{0, 0}, new double[]{1}));
        when(geofenceRepository.findByCompanyIdAndIdIn(eq(3L), any())).thenReturn(List.of(broken, fence(2L, SQUARE)));

        assertThat(matcher.isEligible(cleaner, 5.0, 5.0)).isTrue();
    }

    @Test
    void missingJobLocationIsNotEligible() {
        assertThat(matcher.isEligible(cleaner, null, 5.0)).isFalse();
    }
}
