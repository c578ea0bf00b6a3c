package com.wordgraph.lattice.dto;

import com.wordgraph.lattice.dto.graph.GraphMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildLatticeResponse {

    private String latticeId;
    private GraphMetadata metadata;
    private List<RejectedRecord> rejectedRecords;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
}
