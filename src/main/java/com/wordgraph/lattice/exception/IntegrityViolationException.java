package com.wordgraph.lattice.exception;

import com.wordgraph.lattice.dto.graph.IntegrityReport;

/**
 * Thrown when a minimized lattice no longer spells exactly its input words, or contains a cycle.
 * Always a construction defect; the lattice must not be exported.
 */
public class IntegrityViolationException extends RuntimeException {

    private final IntegrityReport report;

    public IntegrityViolationException(IntegrityReport report) {
        super("Lattice integrity violated: " + report.describe());
        this.report = report;
    }

    public IntegrityReport getReport() {
        return report;
    }
}
