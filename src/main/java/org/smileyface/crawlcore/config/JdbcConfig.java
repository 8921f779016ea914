package org.smileyface.crawlcore.config;

import com.zaxxer.hikari.HikariDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Relational store wiring, active only with {@code orchestrator.store.type=jdbc}.
 */
@Configuration
@ConditionalOnProperty(prefix = "orchestrator.store", name = "type", havingValue = "jdbc")
public class JdbcConfig {

    private static final Logger log = LogManager.getLogger();

    static final String SCHEMA_RESOURCE = "schema/orchestrator-postgres.sql";

    @Bean
    public DataSource dataSource(OrchestratorProperties properties) {
        OrchestratorProperties.Store store = properties.getStore();
        HikariDataSource ds = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(store.getJdbcUrl())
                .username(store.getUsername())
                .password(store.getPassword())
                .build();
        ds.setPoolName("orchestrator");
        log.info("Orchestrator store: {}", store.getJdbcUrl());
        if (store.isInitializeSchema()) {
            // before any store bean can touch the tables
            DatabasePopulatorUtils.execute(new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE)), ds);
            log.info("Orchestrator schema applied from {}", SCHEMA_RESOURCE);
        }
        return ds;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
