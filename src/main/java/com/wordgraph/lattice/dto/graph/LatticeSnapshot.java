package com.wordgraph.lattice.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable node/edge snapshot of a minimized lattice.
 * A truncated snapshot is a display view only and does not encode the full word set.
 */
@Value
@Builder(toBuilder = true)
public class LatticeSnapshot {

    @Singular
    List<GraphNode> nodes;

    @Singular
    List<GraphEdge> edges;

    GraphMetadata metadata;

    boolean truncated;
}
