package com.wordgraph.lattice.model;

import com.wordgraph.lattice.dto.graph.GraphEdge;
import com.wordgraph.lattice.dto.graph.GraphNode;
import com.wordgraph.lattice.dto.graph.LatticeSnapshot;
import com.wordgraph.lattice.exception.UnreachableNodeReferenceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only adjacency view over an exported snapshot.
 * Built once per snapshot and safe to share between concurrent traversals.
 */
public final class SnapshotIndex {

    private final LatticeSnapshot snapshot;
    private final Map<Integer, GraphNode> nodesById;
    private final Map<Integer, List<Integer>> outgoing;
    private final Map<Integer, List<Integer>> incoming;
    private final GraphNode root;

    private SnapshotIndex(LatticeSnapshot snapshot) {
        this.snapshot = snapshot;

        Map<Integer, GraphNode> nodes = new HashMap<>();
        GraphNode foundRoot = null;
        for (GraphNode node : snapshot.getNodes()) {
            nodes.put(node.getId(), node);
            if (node.isRoot()) {
                if (foundRoot != null) {
                    throw new IllegalArgumentException("Snapshot has more than one ROOT node");
                }
                foundRoot = node;
            }
        }
        if (foundRoot == null) {
            throw new IllegalArgumentException("Snapshot has no ROOT node");
        }

        Map<Integer, List<Integer>> out = new HashMap<>();
        Map<Integer, List<Integer>> in = new HashMap<>();
        for (GraphEdge edge : snapshot.getEdges()) {
            out.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
            in.computeIfAbsent(edge.getTarget(), k -> new ArrayList<>()).add(edge.getSource());
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        in.replaceAll((k, v) -> List.copyOf(v));

        this.nodesById = Collections.unmodifiableMap(nodes);
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
        this.root = foundRoot;
    }

    public static SnapshotIndex of(LatticeSnapshot snapshot) {
        return new SnapshotIndex(snapshot);
    }

    public LatticeSnapshot snapshot() {
        return snapshot;
    }

    public GraphNode root() {
        return root;
    }

    public boolean contains(int id) {
        return nodesById.containsKey(id);
    }

    /**
     * @throws UnreachableNodeReferenceException if the id is not part of the snapshot
     */
    public GraphNode node(int id) {
        GraphNode node = nodesById.get(id);
        if (node == null) {
            throw new UnreachableNodeReferenceException(id);
        }
        return node;
    }

    public List<Integer> outgoing(int id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<Integer> incoming(int id) {
        return incoming.getOrDefault(id, List.of());
    }

    public int size() {
        return nodesById.size();
    }
}
