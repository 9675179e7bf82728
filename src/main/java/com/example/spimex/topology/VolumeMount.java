package com.example.spimex.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One volume entry of a service.
 * A source without a leading path character refers to a top-level named volume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolumeMount {

    private String source;
    private String target;
    private String type;

    public boolean isNamed() {
        if (type != null && !type.equals("volume")) {
            return false;
        }
        return source != null && !source.isBlank()
                && !source.startsWith(".") && !source.startsWith("/") && !source.startsWith("~") && !source.startsWith("$");
    }

    /**
     * Parse the short syntax {@code source:target[:mode]}, or {@code target} for an anonymous volume
     */
    public static VolumeMount parse(String spec) {
        var parts = spec.split(":");
        if (parts.length == 1) {
            return new VolumeMount(null, parts[0], "volume");
        }
        var source = parts[0];
        var isPath = source.startsWith(".") || source.startsWith("/") || source.startsWith("~");
        return new VolumeMount(source, parts[1], isPath ? "bind" : "volume");
    }
}
