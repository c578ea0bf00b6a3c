package com.wordgraph.lattice.service.graph;

import com.wordgraph.lattice.model.NodeKind;

import java.util.List;

/**
 * Canonicalization key of a node: its own symbol, its terminal flag and its outgoing
 * transitions to already canonical children, in character order.
 * Two nodes with equal signatures accept the same suffix language from the same symbol.
 */
record NodeSignature(NodeKind kind, char symbol, boolean terminal, List<Transition> transitions) {

    NodeSignature {
        transitions = List.copyOf(transitions);
    }

    record Transition(char symbol, int target) {
    }
}
