package org.smileyface.crawlcore.testutil;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;

import javax.sql.DataSource;

/**
 * Test utility managing a singleton PostgreSQL Testcontainers instance with the orchestrator
 * schema applied.
 *
 * Usage (JUnit 5 example):
 * <pre>
 *   try {
 *     PostgresTestContainer.start();
 *   } catch (Throwable t) {
 *     // Docker not available, skip the JDBC implementation
 *   }
 *   JdbcTemplate jdbc = PostgresTestContainer.jdbcTemplate();
 * </pre>
 */
public final class PostgresTestContainer {

    private static PostgreSQLContainer<?> container;
    private static DataSource dataSource;

    private PostgresTestContainer() {
        // utility
    }

    /**
     * Starts the container and applies the schema. Idempotent and thread-safe.
     */
    public static synchronized void start() {
        if (container != null && container.isRunning()) {
            return;
        }
        container = new PostgreSQLContainer<>("postgres:16-alpine");
        container.start();
        dataSource = new DriverManagerDataSource(container.getJdbcUrl(), container.getUsername(), container.getPassword());
        DatabasePopulatorUtils.execute(
                new ResourceDatabasePopulator(new ClassPathResource("schema/orchestrator-postgres.sql")), dataSource);
    }

    public static synchronized void stop() {
        if (container != null) {
            try {
                container.stop();
            } finally {
                container = null;
                dataSource = null;
            }
        }
    }

    public static JdbcTemplate jdbcTemplate() {
        ensureStarted();
        return new JdbcTemplate(dataSource);
    }

    public static TransactionTemplate transactionTemplate() {
        ensureStarted();
        return new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * Empties the given tables, e.g. the globally shared proxy tables between tests.
     */
    public static void truncate(String... tables) {
        JdbcTemplate jdbc = jdbcTemplate();
        for (String t : tables) {
            jdbc.execute("TRUNCATE TABLE " + t + " CASCADE");
        }
    }

    private static void ensureStarted() {
        if (container == null || !container.isRunning()) {
            throw new IllegalStateException("PostgresTestContainer is not running. Call start() first.");
        }
    }
}
