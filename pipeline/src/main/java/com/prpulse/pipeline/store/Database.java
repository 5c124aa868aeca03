package com.prpulse.pipeline.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Store handle: owns the connection pool and hands out the JDBC helpers the
 * stores and the metrics engine share. Created once by the process entry point
 * and closed when it exits.
 */
public class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final HikariDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate readOnlyTransactions;

    public Database(String jdbcUrl, String username, String password, int maxPoolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maxPoolSize);
        config.setPoolName("prpulse");

        this.dataSource = new HikariDataSource(config);
        this.jdbcTemplate = new JdbcTemplate(dataSource);

        TransactionTemplate template = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        template.setReadOnly(true);
        this.readOnlyTransactions = template;
    }

    /**
     * Creates missing tables and indexes. Safe to run on every start.
     */
    public void applySchema() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE));
        populator.execute(dataSource);
        logger.info("Schema applied from {}", SCHEMA_RESOURCE);
    }

    public JdbcTemplate jdbc() {
        return jdbcTemplate;
    }

    /**
     * Runs work against one connection and one snapshot, so that every query
     * of a metrics call sees the same data.
     */
    public TransactionTemplate readOnlyTransactions() {
        return readOnlyTransactions;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
