package com.wordgraph.lattice.model;

/**
 * Kind of a lattice node. ROOT and END are sentinels that live outside the character alphabet.
 */
public enum NodeKind {
    ROOT("ROOT"),
    CHARACTER(null),
    END("END");

    private final String sentinelLabel;

    NodeKind(String sentinelLabel) {
        this.sentinelLabel = sentinelLabel;
    }

    public boolean isSentinel() {
        return sentinelLabel != null;
    }

    /**
     * Label used when exporting a node of this kind. Character nodes export their own symbol.
     */
    public String label(char symbol) {
        return isSentinel() ? sentinelLabel : String.valueOf(symbol);
    }
}
