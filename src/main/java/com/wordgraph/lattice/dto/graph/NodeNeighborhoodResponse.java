package com.wordgraph.lattice.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Every node that can reach the pivot and every node the pivot can reach.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeNeighborhoodResponse {

    private GraphNode node;
    private List<Integer> ancestorIds;
    private List<Integer> descendantIds;
}
