package com.handyhub.bookingservice.config;

import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the constraints the SQLite dialect leaves out of Hibernate's generated schema.
 * Runs once the entity manager factory has built the tables.
 *
 * <p>{@code idx_engagement_series_index} keeps one engagement per (series, occurrence index);
 * the series generator relies on it to turn a concurrent duplicate insert into a
 * constraint violation.
 */
@Component
public class SchemaConstraintInitializer {

    private static final Logger logger = LoggerFactory.getLogger(SchemaConstraintInitializer.class);

    static final String SERIES_INDEX_NAME = "idx_engagement_series_index";
    static final String SERIES_INDEX_DDL = "CREATE UNIQUE INDEX IF NOT EXISTS " + SERIES_INDEX_NAME
            + " ON engagements (recurrence_series_id, recurrence_index)";

    private final DataSource dataSource;

    // the factory is injected only so that the tables exist before this runs
    public SchemaConstraintInitializer(@Qualifier("dataSource") DataSource dataSource,
                                       @Qualifier("entityManagerFactory") EntityManagerFactory entityManagerFactory) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void ensureConstraints() {
        try (Connection connection = dataSource.getConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute(SERIES_INDEX_DDL);
            logger.info("[SchemaConstraintInitializer] Ensured unique index {}", SERIES_INDEX_NAME);
        } catch (SQLException e) {
            logger.error("[SchemaConstraintInitializer] Could not create {}: {}", SERIES_INDEX_NAME, e.getMessage());
            throw new IllegalStateException("Failed to create unique index " + SERIES_INDEX_NAME
                    + "; duplicate series occurrences may already exist", e);
        }
    }
}
