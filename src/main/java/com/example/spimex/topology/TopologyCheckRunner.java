package com.example.spimex.topology;

import com.example.spimex.SpimexTradingApplication;
import com.example.spimex.config.TopologyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Validates the compose file named by {@code spimex.topology.file} (or {@code --file=})
 * and reports the outcome as the process exit code.
 */
@Slf4j
@Component
@Profile(SpimexTradingApplication.TOPOLOGY_CHECK_PROFILE)
@RequiredArgsConstructor
public class TopologyCheckRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String FILE_OPTION = "file";

    private final ComposeTopologyLoader loader;
    private final TopologyValidator validator;
    private final TopologyProperties properties;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        var file = Path.of(resolveFile(args));
        log.info("Checking deployment topology {}", file.toAbsolutePath());

        List<TopologyViolation> violations;
        try {
            violations = validator.validate(loader.load(file));
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Topology check could not run: {}", e.getMessage());
            exitCode = 2;
            return;
        }

        violations.forEach(violation -> {
            if (violation.getSeverity() == Severity.ERROR) {
                log.error("{}", violation);
            } else {
                log.warn("{}", violation);
            }
        });

        var errors = violations.stream().filter(v -> v.getSeverity() == Severity.ERROR).count();
        var warnings = violations.size() - errors;
        exitCode = errors > 0 || (properties.isStrict() && warnings > 0) ? 1 : 0;

        log.info("Topology check finished: {} error(s), {} warning(s), exit code {}", errors, warnings, exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private String resolveFile(ApplicationArguments args) {
        if (args.containsOption(FILE_OPTION) && !args.getOptionValues(FILE_OPTION).isEmpty()) {
            return args.getOptionValues(FILE_OPTION).get(0);
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            return args.getNonOptionArgs().get(0);
        }
        return properties.getFile();
    }
}
