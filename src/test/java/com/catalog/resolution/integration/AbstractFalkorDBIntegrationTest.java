package com.catalog.resolution.integration;

import com.catalog.resolution.graph.FalkorDBConnection;
import org.junit.jupiter.api.Tag;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

/**
 * Runs catalog tests against a real FalkorDB started by Testcontainers.
 * The container is shared by the class; each test opens its own uniquely named graph,
 * so seeded catalogs never leak between tests.
 */
@Tag("integration")
@Testcontainers
abstract class AbstractFalkorDBIntegrationTest {

    private static final int REDIS_PORT = 6379;

    @SuppressWarnings("resource")
    @Container
    static final GenericContainer<?> falkorDB = new GenericContainer<>("falkordb/falkordb:latest")
            .withExposedPorts(REDIS_PORT);

    /**
     * Opens a connection to an empty graph named {@code <prefix>-<8 hex chars>}, indexes in place.
     */
    protected FalkorDBConnection createConnection(String prefix) {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        FalkorDBConnection connection = new FalkorDBConnection(
                falkorDB.getHost(), falkorDB.getMappedPort(REDIS_PORT), prefix + "-" + suffix);
        connection.ensureCatalogIndexes();
        return connection;
    }
}
