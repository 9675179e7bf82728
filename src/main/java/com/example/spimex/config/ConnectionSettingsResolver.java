package com.example.spimex.config;

import com.example.spimex.exception.InvalidConnectionSettingsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.PropertyResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves database connection settings from the process environment.
 * <p>
 * Two shapes exist in the deployment descriptor: a single {@code DATABASE_DSN} and the
 * discrete {@code DB_HOST}/{@code DB_PORT}/{@code DB_NAME}/{@code DB_USER}/{@code DB_PASSWORD}
 * fields. The DSN is the canonical shape. The discrete form is only a fallback; when both
 * are present they must agree field by field or startup fails.
 */
@Slf4j
public class ConnectionSettingsResolver {

    public static final String DSN = "DATABASE_DSN";
    public static final String HOST = "DB_HOST";
    public static final String PORT = "DB_PORT";
    public static final String NAME = "DB_NAME";
    public static final String USER = "DB_USER";
    public static final String PASSWORD = "DB_PASSWORD";

    private final PropertyResolver environment;

    public ConnectionSettingsResolver(PropertyResolver environment) {
        this.environment = environment;
    }

    public Optional<DatabaseDsn> resolve() {
        var dsn = Optional.ofNullable(value(DSN)).map(DatabaseDsn::parse);
        var discrete = resolveDiscrete();

        if (dsn.isPresent() && discrete.isPresent()) {
            var mismatches = mismatches(dsn.get(), discrete.get());
            if (!mismatches.isEmpty()) {
                throw new InvalidConnectionSettingsException(String.format(
                        "%s and DB_* settings disagree on %s; configure a single connection shape", DSN, mismatches));
            }
            log.warn("Both {} and DB_* settings are present; they agree, using {}", DSN, DSN);
        }

        return dsn.isPresent() ? dsn : discrete;
    }

    private Optional<DatabaseDsn> resolveDiscrete() {
        var host = value(HOST);
        var name = value(NAME);
        var user = value(USER);
        var password = value(PASSWORD);
        var port = value(PORT);

        if (host == null && name == null && user == null && password == null && port == null) {
            return Optional.empty();
        }

        var missing = new ArrayList<String>();
        if (host == null) missing.add(HOST);
        if (name == null) missing.add(NAME);
        if (user == null) missing.add(USER);
        if (!missing.isEmpty()) {
            throw new InvalidConnectionSettingsException("Incomplete discrete database settings, missing " + missing);
        }

        int parsedPort;
        try {
            parsedPort = port != null ? Integer.parseInt(port) : DatabaseDsn.DEFAULT_PORT;
        } catch (NumberFormatException e) {
            throw new InvalidConnectionSettingsException("Invalid " + PORT + ": " + port);
        }

        return Optional.of(DatabaseDsn.builder()
                .host(host)
                .port(parsedPort)
                .database(name)
                .user(user)
                .password(password)
                .build());
    }

    /**
     * Field names on which two connection descriptions disagree
     */
    public static List<String> mismatches(DatabaseDsn left, DatabaseDsn right) {
        var fields = new ArrayList<String>();
        if (!Objects.equals(left.getHost(), right.getHost())) fields.add("host");
        if (left.getPort() != right.getPort()) fields.add("port");
        if (!Objects.equals(left.getDatabase(), right.getDatabase())) fields.add("database");
        if (!Objects.equals(left.getUser(), right.getUser())) fields.add("user");
        if (!Objects.equals(left.getPassword(), right.getPassword())) fields.add("password");
        return fields;
    }

    private String value(String key) {
        var value = environment.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
