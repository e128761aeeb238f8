package com.waypoint.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Picks the goal graph repository: JDBC when a {@link DataSource} is configured
 * (the {@code postgres} profile), otherwise in memory.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public GoalGraphRepository goalGraphRepository(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC goal graph repository");
            var repository = new JdbcGoalGraphRepository(ds);
            repository.createTables();
            return repository;
        }
        log.info("No DataSource available; using in-memory goal graph repository (goals will not persist across restarts)");
        return new InMemoryGoalGraphRepository();
    }
}
