package com.wordgraph.lattice.service.graph;

import lombok.Value;

import java.util.List;

/**
 * Sorted strings produced by a path walk, possibly cut at the result cap.
 */
@Value
public class PathSet {

    List<String> values;
    boolean truncated;
}
