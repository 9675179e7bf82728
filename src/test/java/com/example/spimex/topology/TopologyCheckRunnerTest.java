package com.example.spimex.topology;

import com.example.spimex.config.TopologyProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TopologyCheckRunner Tests")
class TopologyCheckRunnerTest {

    private TopologyProperties properties;
    private TopologyCheckRunner runner;

    @BeforeEach
    void setUp() {
        properties = new TopologyProperties();
        runner = new TopologyCheckRunner(new ComposeTopologyLoader(), new TopologyValidator(), properties);
    }

    @Test
    @DisplayName("Should exit with 0 for a conforming file")
    void shouldPassConformingFile() {
        runner.run(new DefaultApplicationArguments("--file=src/test/resources/topology/single-api-compose.yml"));

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should fall back to the configured file")
    void shouldUseConfiguredFile() {
        properties.setFile("docker-compose.yml");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should exit with 1 when violations are found")
    void shouldFailOnViolations() {
        runner.run(new DefaultApplicationArguments("src/test/resources/topology/misconfigured-compose.yml"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should treat warnings as failures in strict mode")
    void shouldFailOnWarningsWhenStrict() {
        properties.setStrict(true);

        runner.run(new DefaultApplicationArguments("--file=src/test/resources/topology/warnings-only-compose.yml"));

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should tolerate warnings by default")
    void shouldPassWarningsByDefault() {
        runner.run(new DefaultApplicationArguments("--file=src/test/resources/topology/warnings-only-compose.yml"));

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should exit with 2 when the file cannot be read")
    void shouldReportUnreadableFile() {
        runner.run(new DefaultApplicationArguments("--file=src/test/resources/topology/not-yaml.yml"));

        assertThat(runner.getExitCode()).isEqualTo(2);
    }
}
