package com.wordgraph.lattice.dto.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.wordgraph.lattice.model.NodeKind;
import lombok.Builder;
import lombok.Value;

/**
 * Exported lattice node. Immutable once part of a snapshot.
 */
@Value
@Builder
public class GraphNode {

    int id;             // BFS discovery order, root is 0
    String label;       // Single character, or ROOT / END
    NodeKind kind;
    int level;          // Shortest distance from the root

    @JsonIgnore
    public boolean isRoot() {
        return kind == NodeKind.ROOT;
    }

    @JsonIgnore
    public boolean isEnd() {
        return kind == NodeKind.END;
    }

    /**
     * Text this node contributes to a word: its character, or nothing for a sentinel.
     */
    public String text() {
        return kind.isSentinel() ? "" : label;
    }
}
