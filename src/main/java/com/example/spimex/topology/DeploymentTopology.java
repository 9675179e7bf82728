package com.example.spimex.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeploymentTopology {

    @Builder.Default
    private Map<String, ServiceDescriptor> services = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, VolumeDescriptor> volumes = new LinkedHashMap<>();

    public Optional<ServiceDescriptor> service(String name) {
        return Optional.ofNullable(services.get(name));
    }

    public List<ServiceDescriptor> servicesWithRole(ServiceRole role) {
        return services.values().stream()
                .filter(service -> service.role() == role)
                .toList();
    }
}
