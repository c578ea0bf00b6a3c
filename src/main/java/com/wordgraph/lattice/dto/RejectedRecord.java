package com.wordgraph.lattice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input record refused before building, with its position in the submitted list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectedRecord {

    private int index;
    private String value;
    private String reason;
}
