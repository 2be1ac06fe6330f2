package com.amqpcore;

import com.amqpcore.persistence.DatabaseManager;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Base class for tests that require a real PostgreSQL database. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresTest {

    @Container
    protected static final PostgreSQLContainer<?> postgresContainer =
        new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("amqpcore_test")
            .withUsername("test")
            .withPassword("test");

    protected static DatabaseManager databaseManager;

    @BeforeAll
    public static void setUpDatabase() {
        postgresContainer.start();
        databaseManager = new DatabaseManager(postgresContainer.getJdbcUrl(), postgresContainer.getUsername(),
                postgresContainer.getPassword(), 4);
    }

    @AfterAll
    public static void tearDownDatabase() {
        if (databaseManager != null) {
            databaseManager.close();
        }
    }

    protected DatabaseManager getDatabaseManager() {
        return databaseManager;
    }
}
