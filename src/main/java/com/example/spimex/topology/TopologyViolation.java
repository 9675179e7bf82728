package com.example.spimex.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopologyViolation {

    private ViolationType type;
    private Severity severity;
    private String service;
    private String message;

    public static TopologyViolation error(ViolationType type, String service, String message) {
        return new TopologyViolation(type, Severity.ERROR, service, message);
    }

    public static TopologyViolation warning(ViolationType type, String service, String message) {
        return new TopologyViolation(type, Severity.WARNING, service, message);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (%s): %s", severity, type, service != null ? service : "-", message);
    }
}
