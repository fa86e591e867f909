package com.realestate.spatial.module.test.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Base class for tests that need a real PostGIS database.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgisContainerSupport {

    private static final DockerImageName POSTGIS_IMAGE = DockerImageName.parse("postgis/postgis:15-3.4")
            .asCompatibleSubstituteFor("postgres");

    @Container
    @SuppressWarnings("resource")
    protected static final PostgreSQLContainer<?> POSTGIS = new PostgreSQLContainer<>(POSTGIS_IMAGE)
            .withDatabaseName("realestate_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void datasourceProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGIS::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGIS::getUsername);
        registry.add("spring.datasource.password", POSTGIS::getPassword);
    }
}
