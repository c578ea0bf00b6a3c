package com.wordgraph.lattice.exception;

public class LatticeNotFoundException extends RuntimeException {

    public LatticeNotFoundException(String message) {
        super(message);
    }
}
