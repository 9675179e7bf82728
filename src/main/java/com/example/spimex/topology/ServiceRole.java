package com.example.spimex.topology;

import java.util.Arrays;
import java.util.Locale;

/**
 * Part a service plays in the deployment.
 * <p>
 * Taken from the {@code spimex.role} label when present, otherwise inferred from the
 * active Spring profile, the image and the command.
 */
public enum ServiceRole {
    STORE,
    BROKER,
    API,
    WORKER,
    SCHEDULER,
    OTHER;

    public static final String ROLE_LABEL = "spimex.role";

    static ServiceRole of(ServiceDescriptor service) {
        var label = service.getLabels().get(ROLE_LABEL);
        if (label != null && !label.isBlank()) {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        }

        var image = service.getImage() != null ? service.getImage().toLowerCase(Locale.ROOT) : "";
        if (image.startsWith("postgres")) {
            return STORE;
        }
        if (image.startsWith("redis") || image.startsWith("valkey")) {
            return BROKER;
        }

        var profiles = service.env("SPRING_PROFILES_ACTIVE").orElse("");
        var fromProfile = Arrays.stream(profiles.split(","))
                .map(String::trim)
                .map(ServiceRole::fromProfile)
                .filter(role -> role != OTHER)
                .findFirst();
        if (fromProfile.isPresent()) {
            return fromProfile.get();
        }

        var command = service.getCommand() != null ? service.getCommand().toLowerCase(Locale.ROOT) : "";
        if (command.contains("beat") || command.contains("scheduler")) {
            return SCHEDULER;
        }
        if (command.contains("worker")) {
            return WORKER;
        }
        if (command.contains("uvicorn") || command.contains("gunicorn") || command.contains("serve")) {
            return API;
        }
        return OTHER;
    }

    private static ServiceRole fromProfile(String profile) {
        switch (profile) {
            case "api":
                return API;
            case "worker":
                return WORKER;
            case "beat":
                return SCHEDULER;
            default:
                return OTHER;
        }
    }
}
