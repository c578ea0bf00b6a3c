package com.wordgraph.lattice.dto.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of an integrity check over a minimized lattice or an exported snapshot.
 */
@Value
@Builder
public class IntegrityReport {

    int expectedWordCount;
    int reconstructedWordCount;

    @Singular
    List<String> missingWords;      // Input words the graph no longer spells

    @Singular
    List<String> unexpectedWords;   // Words the graph spells that were never inserted

    @Singular("cycleStep")
    List<String> cycle;             // Labels along a cycle witness, first and last equal

    @Singular
    List<Integer> unreachableNodeIds;   // Non-root nodes no path from the root reaches

    public boolean isPassed() {
        return missingWords.isEmpty() && unexpectedWords.isEmpty() && cycle.isEmpty() && unreachableNodeIds.isEmpty();
    }

    public boolean hasCycle() {
        return !cycle.isEmpty();
    }

    public String describe() {
        if (isPassed()) {
            return "lattice spells exactly " + expectedWordCount + " words";
        }
        if (hasCycle()) {
            return "cycle detected: " + String.join(" -> ", cycle);
        }
        if (!unreachableNodeIds.isEmpty()) {
            return "unreachable nodes: " + unreachableNodeIds;
        }
        return "word set mismatch: missing=" + missingWords + ", unexpected=" + unexpectedWords;
    }
}
