package com.wordgraph.lattice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Configuration for the lattice pipeline.
 * Reads input normalization, traversal limits and store retention from application.yml.
 */
@Configuration
@EnableScheduling
@Slf4j
public class LatticeConfig {

    @Value("${lattice.input.lowercase:true}")
    private boolean lowercaseInput;

    @Value("${lattice.input.reserved-characters:$}")
    private String reservedCharacters;

    @Value("${lattice.traversal.max-results:10000}")
    private int maxTraversalResults;

    @Value("${lattice.export.default-max-nodes:5000}")
    private int defaultMaxExportNodes;

    @Value("${lattice.store.ttl-hours:24}")
    private long ttlHours;

    @Bean
    public LatticeSettings latticeSettings() {
        if (maxTraversalResults <= 0) {
            throw new IllegalArgumentException("lattice.traversal.max-results must be positive");
        }
        if (defaultMaxExportNodes <= 0) {
            throw new IllegalArgumentException("lattice.export.default-max-nodes must be positive");
        }
        if (ttlHours <= 0) {
            throw new IllegalArgumentException("lattice.store.ttl-hours must be positive");
        }

        log.info("[Lattice Config] lowercase={}, reserved='{}', maxTraversalResults={}, defaultMaxExportNodes={}, ttlHours={}",
                lowercaseInput, reservedCharacters, maxTraversalResults, defaultMaxExportNodes, ttlHours);

        return LatticeSettings.builder()
                .lowercaseInput(lowercaseInput)
                .reservedCharacters(reservedCharacters == null ? "" : reservedCharacters)
                .maxTraversalResults(maxTraversalResults)
                .defaultMaxExportNodes(defaultMaxExportNodes)
                .ttlHours(ttlHours)
                .build();
    }
}
