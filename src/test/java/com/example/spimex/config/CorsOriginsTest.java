package com.example.spimex.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorsOrigins Tests")
class CorsOriginsTest {

    @Test
    @DisplayName("Should parse a JSON array string")
    void shouldParseJsonArray() {
        var origins = CorsOrigins.parse("[\"http://localhost:3000\",\"http://localhost:8000/\"]");

        assertThat(origins).containsExactly("http://localhost:3000", "http://localhost:8000");
    }

    @Test
    @DisplayName("Should parse a comma-separated list")
    void shouldParseCommaSeparated() {
        var origins = CorsOrigins.parse("https://a.example.com, https://b.example.com,");

        assertThat(origins).containsExactly("https://a.example.com", "https://b.example.com");
    }

    @Test
    @DisplayName("Should use defaults when unset")
    void shouldUseDefaults() {
        assertThat(CorsOrigins.parse(null)).isEqualTo(CorsOrigins.DEFAULT_ORIGINS);
        assertThat(CorsOrigins.parse("")).isEqualTo(CorsOrigins.DEFAULT_ORIGINS);
    }

    @Test
    @DisplayName("Should keep the wildcard")
    void shouldKeepWildcard() {
        assertThat(CorsOrigins.parse("*")).containsExactly("*");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> CorsOrigins.parse("[\"http://localhost:3000\""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("BACKEND_CORS_ORIGINS");
    }

    @Test
    @DisplayName("Should reject non-http origins")
    void shouldRejectNonHttpOrigin() {
        assertThatThrownBy(() -> CorsOrigins.parse("ftp://files.example.com"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ftp://files.example.com");
    }
}
