package com.realestate.spatial.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.locationtech.jts.geom.Geometry;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Named search geometry. The geometry never changes after insert; retiring an
 * area only clears its active flag.
 */
@Entity
@Table(name = "spatial_areas")
@EntityListeners(AuditingEntityListener.class)
@Getter
@NoArgsConstructor
public class SavedArea {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Setter
    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "area_type", nullable = false, length = 30)
    private AreaType areaType;

    @Column(name = "geom", nullable = false, updatable = false, columnDefinition = "geometry(Geometry,4326)")
    private Geometry geometry;

    @Setter
    @Column(name = "start_city", length = 200)
    private String startLabel;

    @Setter
    @Column(name = "end_city", length = 200)
    private String endLabel;

    @Setter
    @Column(name = "buffer_m")
    private Integer bufferMeters;

    @Setter
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public SavedArea(String name, AreaType areaType, Geometry geometry) {
        this.name = name;
        this.areaType = areaType;
        this.geometry = geometry;
    }

    /**
     * Fallback when auditing is not active (plain JPA slices).
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
