package com.washdispatch.model;

import com.washdispatch.mapper.PolygonJsonConverter;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.List;

@Entity
@Table(name = "company_geofences")
@Getter
@Setter
public class Geofence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private Long companyId;

    @Column(name = "name", nullable = false)
    private String name;

    // ordered [lat, lng] vertices, stored as a JSON array
    @Convert(converter = PolygonJsonConverter.class)
    @Column(name = "polygon", nullable = false, columnDefinition = "text")
    private List<double[]> polygon;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
