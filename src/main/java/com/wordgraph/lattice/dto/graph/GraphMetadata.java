package com.wordgraph.lattice.dto.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one lattice build, carried alongside the exported snapshot.
 */
@Value
@Builder(toBuilder = true)
public class GraphMetadata {

    int inputRecordCount;
    int distinctWordCount;
    int rejectedRecordCount;
    int rawNodeCount;           // Trie nodes before minimization, root included
    int mergedNodeCount;        // Trie nodes folded into a canonical representative or pruned
    int nodeCount;              // Exported nodes, ROOT and END included
    int edgeCount;
    int maxLevel;
    long buildMillis;
}
