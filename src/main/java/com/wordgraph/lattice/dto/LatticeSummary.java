package com.wordgraph.lattice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One stored lattice in a listing, without its graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LatticeSummary {

    private String latticeId;
    private int wordCount;
    private int rejectedRecordCount;
    private int nodeCount;
    private int edgeCount;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
}
