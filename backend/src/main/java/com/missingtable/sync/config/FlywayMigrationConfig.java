package com.missingtable.sync.config;

import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayMigrationConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    // repair clears failed migration entries left by an interrupted deploy
    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy(@Value("${sync.flyway.repair-on-start:false}") boolean repairOnStart) {
        return flyway -> {
            if (repairOnStart) {
                log.info("[Flyway] repairing schema history before migrate");
                flyway.repair();
            }
            var result = flyway.migrate();
            log.info("[Flyway] {} migration(s) applied, schema at {}", result.migrationsExecuted,
                    result.targetSchemaVersion != null ? result.targetSchemaVersion : currentVersion(flyway));
        };
    }

    private static String currentVersion(Flyway flyway) {
        var current = flyway.info().current();
        return current == null ? "empty" : current.getVersion().getVersion();
    }
}
