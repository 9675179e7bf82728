package com.example.spimex.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative description of one deployable process
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceDescriptor {

    private String name;
    private String image;
    private String buildContext;

    @Builder.Default
    private List<String> ports = new ArrayList<>();

    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();

    @Builder.Default
    private List<VolumeMount> volumes = new ArrayList<>();

    private String command;
    private String restart;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    @Builder.Default
    private int replicas = 1;

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    public Optional<String> env(String key) {
        var value = environment.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public ServiceRole role() {
        return ServiceRole.of(this);
    }
}
