package com.example.spimex.broker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sizes of the broker's lists and sorted sets
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueDepth {
    private long ready;
    private long processing;
    private long delayed;
    private long deadLettered;
}
