package com.wordgraph.lattice.service;

import com.wordgraph.lattice.dto.RejectedRecord;
import lombok.Value;

import java.util.List;

/**
 * Normalized, de-duplicated words ready for insertion, plus the records that were refused.
 */
@Value
public class ValidatedInput {

    int recordCount;
    List<String> words;                     // Distinct, in first-seen order
    List<RejectedRecord> rejectedRecords;
}
