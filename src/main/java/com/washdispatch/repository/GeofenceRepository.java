package com.washdispatch.repository;

import com.washdispatch.model.Geofence;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface GeofenceRepository extends JpaRepository<Geofence, Long> {
    List<Geofence> findByCompanyIdOrderByNameAsc(Long companyId);

    List<Geofence> findByCompanyIdAndIdIn(Long companyId, Collection<Long> ids);
}
