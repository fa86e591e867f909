package com.realestate.spatial.infrastructure.persistence;

import com.realestate.spatial.application.port.out.ListingRepository;
import com.realestate.spatial.application.port.out.SavedAreaRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Wires the JPA repositories to the application's output ports.
 * Marked primary because each JPA repository is itself a candidate for its port.
 */
@Configuration
public class PersistenceAdapterConfig {

    @Bean
    @Primary
    public ListingRepository listingRepository(ListingJpaRepository jpaRepository) {
        return jpaRepository;
    }

    @Bean
    @Primary
    public SavedAreaRepository savedAreaRepository(SavedAreaJpaRepository jpaRepository) {
        return jpaRepository;
    }
}
