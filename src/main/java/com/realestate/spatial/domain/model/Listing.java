package com.realestate.spatial.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.locationtech.jts.geom.Point;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Listing row as seen by the spatial engine.
 * The table is owned by the listing subsystem; only the coordinate and
 * geocode columns are written from here. {@code location_point} is kept in
 * sync by a database trigger.
 */
@Entity
@Table(name = "listings")
@Getter
@Setter
@NoArgsConstructor
public class Listing {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "price", precision = 14, scale = 2)
    private BigDecimal price;

    @Column(name = "location_text", length = 500)
    private String locationText;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "location_point", columnDefinition = "geometry(Point,4326)", insertable = false, updatable = false)
    private Point locationPoint;

    @Column(name = "property_type", length = 50)
    private String propertyType;

    @Column(name = "offer_type", length = 50)
    private String offerType;

    @Column(name = "main_photo_url", length = 1000)
    private String mainPhotoUrl;

    @Column(name = "source_code", length = 50)
    private String sourceCode;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "first_seen_at", nullable = false)
    private OffsetDateTime firstSeenAt;

    @Column(name = "geocoded_at")
    private OffsetDateTime geocodedAt;

    @Column(name = "geocode_attempted_at")
    private OffsetDateTime geocodeAttemptedAt;

    @Column(name = "geocode_source", nullable = false, length = 30)
    private GeocodeSource geocodeSource = GeocodeSource.NONE;

    public Listing(String title, String locationText) {
        this.title = title;
        this.locationText = locationText;
        this.firstSeenAt = OffsetDateTime.now();
    }

    @PrePersist
    protected void onCreate() {
        if (firstSeenAt == null) {
            firstSeenAt = OffsetDateTime.now();
        }
    }

    public boolean hasCoordinate() {
        return latitude != null && longitude != null;
    }
}
