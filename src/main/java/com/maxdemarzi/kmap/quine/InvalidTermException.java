package com.maxdemarzi.kmap.quine;

public class InvalidTermException extends IllegalArgumentException {

    public InvalidTermException(long term, int numVars) {
        super("Term " + term + " is outside [0, " + (1L << numVars) + ") for " + numVars + " variables");
    }

    public InvalidTermException(String message) {
        super(message);
    }
}
