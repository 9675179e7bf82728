package com.example.spimex.startup;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.stereotype.Component;

/**
 * Orders API startup: wait for the store, then migrate.
 * <p>
 * Runs while the context is refreshing, before the embedded server starts, so a
 * failure here aborts the process before the port is ever bound. Flyway is only
 * enabled for the api role; workers and the beat never migrate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MigrationStartupStrategy implements FlywayMigrationStrategy {

    private final StoreReadinessGate storeReadinessGate;

    @Override
    public void migrate(Flyway flyway) {
        storeReadinessGate.awaitReachable();

        log.info("Applying schema migrations");
        var result = flyway.migrate();
        log.info("Schema migrations complete: {} applied, schema version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
    }
}
