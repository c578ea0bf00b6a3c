package com.wordgraph.lattice.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-addressed arena of lattice nodes with a single root at index 0.
 * Node ids are arena indices and are never reused within one graph.
 */
public class LatticeGraph {

    public static final int ROOT_ID = 0;

    private final List<LatticeNode> nodes = new ArrayList<>();

    public LatticeGraph() {
        nodes.add(new LatticeNode(ROOT_ID, NodeKind.ROOT, '\0', 0));
    }

    public LatticeNode root() {
        return nodes.get(ROOT_ID);
    }

    public LatticeNode node(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IndexOutOfBoundsException("No lattice node with id " + id);
        }
        return nodes.get(id);
    }

    public LatticeNode addNode(char symbol, int depth) {
        LatticeNode node = new LatticeNode(nodes.size(), NodeKind.CHARACTER, symbol, depth);
        nodes.add(node);
        return node;
    }

    public int size() {
        return nodes.size();
    }

    public int transitionCount() {
        int count = 0;
        for (LatticeNode node : nodes) {
            count += node.getTransitions().size();
        }
        return count;
    }

    public int terminalCount() {
        int count = 0;
        for (LatticeNode node : nodes) {
            if (node.isTerminal()) count++;
        }
        return count;
    }
}
