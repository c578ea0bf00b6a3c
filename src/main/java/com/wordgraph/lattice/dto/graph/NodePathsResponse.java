package com.wordgraph.lattice.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Prefixes, suffixes and words reconstructed through one pivot node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodePathsResponse {

    private GraphNode node;
    private List<String> prefixes;      // Root to pivot, pivot character included
    private List<String> suffixes;      // After the pivot up to END
    private List<String> words;         // prefix + suffix for every pair
    private boolean truncated;          // true if any list hit the result cap
}
