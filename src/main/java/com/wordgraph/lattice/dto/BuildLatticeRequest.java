package com.wordgraph.lattice.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to build a lattice from a flat word list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildLatticeRequest {

    @NotNull(message = "words must be provided")
    private List<String> words;     // One record per word

    private boolean failFast;       // Abort on the first malformed record instead of skipping it
}
