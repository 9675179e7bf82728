package com.example.spimex.topology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a compose file into a {@link DeploymentTopology}.
 * <p>
 * Accepts both the short and the long compose syntax for environment, ports, volumes,
 * depends_on, labels and command. Keys the checks do not use are ignored.
 */
@Slf4j
@Component
public class ComposeTopologyLoader {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    public DeploymentTopology load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Compose file not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read compose file " + path, e);
        }
    }

    public DeploymentTopology load(InputStream in) {
        Map<String, Object> document;
        try {
            document = yamlMapper.readValue(in, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new IllegalArgumentException("Compose file is not valid YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new IllegalArgumentException("Compose file is empty");
        }

        var topology = new DeploymentTopology();
        asMap(document.get("services")).forEach((name, definition) ->
                topology.getServices().put(name, toService(name, asMap(definition))));
        asMap(document.get("volumes")).forEach((name, definition) ->
                topology.getVolumes().put(name, toVolume(name, asMap(definition))));

        log.debug("Loaded topology with {} services and {} volumes", topology.getServices().size(), topology.getVolumes().size());
        return topology;
    }

    private ServiceDescriptor toService(String name, Map<String, Object> definition) {
        return ServiceDescriptor.builder()
                .name(name)
                .image(asString(definition.get("image")))
                .buildContext(buildContext(definition.get("build")))
                .ports(ports(definition.get("ports")))
                .environment(keyValues(definition.get("environment")))
                .volumes(volumeMounts(definition.get("volumes")))
                .command(command(definition.get("command")))
                .restart(asString(definition.get("restart")))
                .dependsOn(dependsOn(definition.get("depends_on")))
                .replicas(replicas(definition.get("deploy")))
                .labels(keyValues(definition.get("labels")))
                .build();
    }

    private VolumeDescriptor toVolume(String name, Map<String, Object> definition) {
        var external = definition.get("external");
        return new VolumeDescriptor(name, external != null && !Boolean.FALSE.equals(external) && !"false".equals(external.toString()));
    }

    private String buildContext(Object build) {
        if (build instanceof Map<?, ?> map) {
            return asString(map.get("context"));
        }
        return asString(build);
    }

    private List<String> ports(Object ports) {
        var result = new ArrayList<String>();
        for (var port : asList(ports)) {
            if (port instanceof Map<?, ?> map) {
                var published = map.get("published");
                var target = asString(map.get("target"));
                result.add(published != null ? published + ":" + target : target);
            } else {
                result.add(asString(port));
            }
        }
        return result;
    }

    /**
     * Environment and labels: a list of {@code KEY=VALUE} or a mapping
     */
    private Map<String, String> keyValues(Object value) {
        var result = new LinkedHashMap<String, String>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, entry) -> result.put(key.toString(), entry == null ? "" : entry.toString()));
            return result;
        }
        for (var item : asList(value)) {
            var text = asString(item);
            var separator = text.indexOf('=');
            if (separator < 0) {
                result.put(text, "");
            } else {
                result.put(text.substring(0, separator), text.substring(separator + 1));
            }
        }
        return result;
    }

    private List<VolumeMount> volumeMounts(Object volumes) {
        var result = new ArrayList<VolumeMount>();
        for (var volume : asList(volumes)) {
            if (volume instanceof Map<?, ?> map) {
                var type = asString(map.get("type"));
                result.add(new VolumeMount(asString(map.get("source")), asString(map.get("target")), type != null ? type : "volume"));
            } else {
                result.add(VolumeMount.parse(asString(volume)));
            }
        }
        return result;
    }

    private String command(Object command) {
        if (command instanceof List<?> list) {
            return list.stream().map(String::valueOf).collect(Collectors.joining(" "));
        }
        return asString(command);
    }

    private List<String> dependsOn(Object dependsOn) {
        if (dependsOn instanceof Map<?, ?> map) {
            return map.keySet().stream().map(Object::toString).toList();
        }
        return asList(dependsOn).stream().map(String::valueOf).toList();
    }

    private int replicas(Object deploy) {
        var replicas = asMap(deploy).get("replicas");
        if (replicas == null) {
            return 1;
        }
        try {
            return Integer.parseInt(replicas.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("deploy.replicas is not a number: " + replicas);
        }
    }

    private static Map<String, Object> asMap(Object value) {
        var result = new LinkedHashMap<String, Object>();
        if (value == null) {
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((key, entry) -> result.put(String.valueOf(key), entry));
            return result;
        }
        throw new IllegalArgumentException("Expected a mapping but found: " + value);
    }

    private static List<?> asList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list;
        }
        throw new IllegalArgumentException("Expected a list but found: " + value);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
