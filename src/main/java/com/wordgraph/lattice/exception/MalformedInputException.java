package com.wordgraph.lattice.exception;

import com.wordgraph.lattice.dto.RejectedRecord;

import java.util.List;

/**
 * Thrown when input records cannot be inserted into a lattice.
 */
public class MalformedInputException extends RuntimeException {

    private final List<RejectedRecord> rejectedRecords;

    public MalformedInputException(String message, List<RejectedRecord> rejectedRecords) {
        super(message);
        this.rejectedRecords = List.copyOf(rejectedRecords);
    }

    public List<RejectedRecord> getRejectedRecords() {
        return rejectedRecords;
    }
}
