package com.wordgraph.lattice.dto.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Exported directed edge. The label repeats the target's label for display.
 */
@Value
@Builder
public class GraphEdge {

    String id;          // "{source}->{target}"
    int source;
    int target;
    String label;

    public static GraphEdge of(int source, int target, String label) {
        return GraphEdge.builder()
                .id(source + "->" + target)
                .source(source)
                .target(target)
                .label(label)
                .build();
    }
}
