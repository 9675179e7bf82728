package com.example.spimex.topology;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Top-level named volume. Its lifecycle is independent of the containers mounting it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolumeDescriptor {
    private String name;
    private boolean external;
}
