package com.wordgraph.lattice.model;

import com.wordgraph.lattice.dto.RejectedRecord;
import com.wordgraph.lattice.dto.graph.LatticeSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A built lattice kept for querying: its immutable snapshot, the adjacency index over it,
 * and the words it was verified against.
 */
@Value
@Builder
public class StoredLattice {

    String latticeId;
    LatticeSnapshot snapshot;
    SnapshotIndex index;
    List<String> words;
    List<RejectedRecord> rejectedRecords;
    LocalDateTime createdAt;
    LocalDateTime expiresAt;        // For cleanup scheduler

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
