package com.maxdemarzi.kmap.quine;

import java.util.Collections;
import java.util.Map;

public class TruthTableRow {
    private final int index;
    private final Map<String, Boolean> assignment;
    private final int output;

    public TruthTableRow(int index, Map<String, Boolean> assignment, int output) {
        this.index = index;
        this.assignment = Collections.unmodifiableMap(assignment);
        this.output = output;
    }

    public int getIndex() {
        return index;
    }

    /** Variable name to value, in variable order. */
    public Map<String, Boolean> getAssignment() {
        return assignment;
    }

    public int getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return index + " " + assignment + " -> " + output;
    }
}
