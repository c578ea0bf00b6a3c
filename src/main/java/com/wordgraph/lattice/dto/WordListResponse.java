package com.wordgraph.lattice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WordListResponse {

    private String latticeId;
    private int count;
    private List<String> words;
    private boolean truncated;
}
