package com.example.spimex.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URI;
import java.util.Arrays;
import java.util.List;

/**
 * Parser for {@code BACKEND_CORS_ORIGINS}.
 * <p>
 * Accepts a JSON array ({@code ["http://localhost:3000","http://localhost:8000"]})
 * or a comma-separated list. Every entry must be an absolute http(s) URL or {@code *}.
 */
public final class CorsOrigins {

    public static final List<String> DEFAULT_ORIGINS = List.of("http://localhost", "http://127.0.0.1");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CorsOrigins() {
    }

    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULT_ORIGINS;
        }

        var trimmed = raw.trim();
        List<String> origins;
        if (trimmed.startsWith("[")) {
            try {
                origins = MAPPER.readValue(trimmed, new TypeReference<List<String>>() {});
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("BACKEND_CORS_ORIGINS is not a valid JSON array: " + e.getOriginalMessage(), e);
            }
        } else {
            origins = Arrays.asList(trimmed.split(","));
        }

        return origins.stream()
                .filter(origin -> origin != null && !origin.isBlank())
                .map(String::trim)
                .map(CorsOrigins::normalize)
                .distinct()
                .toList();
    }

    private static String normalize(String origin) {
        if (origin.equals("*")) {
            return origin;
        }
        var uri = URI.create(origin);
        var scheme = uri.getScheme();
        if (scheme == null || !(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid CORS origin: " + origin);
        }
        // Browsers send origins without a trailing slash
        return origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
    }
}
