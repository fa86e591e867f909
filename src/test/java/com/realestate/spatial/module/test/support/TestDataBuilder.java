package com.realestate.spatial.module.test.support;

import com.realestate.spatial.application.port.out.ListingRepository;
import com.realestate.spatial.domain.model.Coordinate;
import com.realestate.spatial.domain.model.GeocodeSource;
import com.realestate.spatial.domain.model.Listing;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Fluent builder that persists listings for integration tests.
 */
@Component
public class TestDataBuilder {

    private static final OffsetDateTime BASE_TIME = OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final ListingRepository listingRepository;
    private int sequence;

    public TestDataBuilder(ListingRepository listingRepository) {
        this.listingRepository = listingRepository;
    }

    public ListingBuilder listing() {
        return new ListingBuilder();
    }

    public class ListingBuilder {
        private String title;
        private String locationText = "Praha";
        private Coordinate coordinate;
        private String propertyType = "flat";
        private String offerType = "sale";
        private BigDecimal price = new BigDecimal("4500000");
        private boolean active = true;
        private OffsetDateTime firstSeenAt;

        public ListingBuilder withTitle(String title) {
            this.title = title;
            return this;
        }

        public ListingBuilder withLocationText(String locationText) {
            this.locationText = locationText;
            return this;
        }

        public ListingBuilder at(Coordinate coordinate) {
            this.coordinate = coordinate;
            return this;
        }

        public ListingBuilder at(double latitude, double longitude) {
            return at(new Coordinate(latitude, longitude));
        }

        public ListingBuilder withPropertyType(String propertyType) {
            this.propertyType = propertyType;
            return this;
        }

        public ListingBuilder withOfferType(String offerType) {
            this.offerType = offerType;
            return this;
        }

        public ListingBuilder withPrice(BigDecimal price) {
            this.price = price;
            return this;
        }

        public ListingBuilder inactive() {
            this.active = false;
            return this;
        }

        public ListingBuilder firstSeenAt(OffsetDateTime firstSeenAt) {
            this.firstSeenAt = firstSeenAt;
            return this;
        }

        public Listing save() {
            int n = ++sequence;
            Listing listing = new Listing(title != null ? title : "Listing " + n, locationText);
            listing.setFirstSeenAt(firstSeenAt != null ? firstSeenAt : BASE_TIME.plusMinutes(n));
            listing.setPropertyType(propertyType);
            listing.setOfferType(offerType);
            listing.setPrice(price);
            listing.setActive(active);
            listing.setSourceCode("test");
            if (coordinate != null) {
                listing.setLatitude(coordinate.getLatitude());
                listing.setLongitude(coordinate.getLongitude());
                listing.setGeocodeSource(GeocodeSource.PROVIDER_SUPPLIED);
                listing.setGeocodedAt(listing.getFirstSeenAt());
            }
            return listingRepository.save(listing);
        }
    }
}
