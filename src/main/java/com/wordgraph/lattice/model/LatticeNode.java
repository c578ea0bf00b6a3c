package com.wordgraph.lattice.model;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Construction-time node of the lattice arena.
 * Transitions are keyed by the next character and point at arena indices, never at objects,
 * so a shared suffix is simply several transitions holding the same index.
 */
@Getter
public class LatticeNode {

    private final int id;
    private final NodeKind kind;
    private final char symbol;
    private final int depth;            // Distance from the root along the insertion path

    @Setter
    private boolean terminal;

    private final NavigableMap<Character, Integer> transitions = new TreeMap<>();

    LatticeNode(int id, NodeKind kind, char symbol, int depth) {
        this.id = id;
        this.kind = kind;
        this.symbol = symbol;
        this.depth = depth;
    }

    public String label() {
        return kind.label(symbol);
    }

    public Integer child(char c) {
        return transitions.get(c);
    }

    /**
     * Point the transition on {@code c} at {@code target}, replacing any existing one.
     */
    public void link(char c, int target) {
        transitions.put(c, target);
    }

    public NavigableMap<Character, Integer> getTransitions() {
        return Collections.unmodifiableNavigableMap(transitions);
    }

    @Override
    public String toString() {
        return "LatticeNode{" + id + ":" + label() + (terminal ? "*" : "") + " -> " + transitions + "}";
    }
}
