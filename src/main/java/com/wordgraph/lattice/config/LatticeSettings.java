package com.wordgraph.lattice.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable runtime settings for the lattice pipeline, resolved from application.yml.
 */
@Value
@Builder
public class LatticeSettings {

    @Builder.Default
    boolean lowercaseInput = true;

    @Builder.Default
    String reservedCharacters = "$";

    @Builder.Default
    int maxTraversalResults = 10_000;

    @Builder.Default
    int defaultMaxExportNodes = 5_000;

    @Builder.Default
    long ttlHours = 24;

    public static LatticeSettings defaults() {
        return LatticeSettings.builder().build();
    }
}
