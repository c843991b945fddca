package com.maxdemarzi.kmap.results;

import java.util.Map;

public class TruthRowResult {
    public final Long index;
    public final Map<String, Object> assignment;
    public final Long output;

    public TruthRowResult(Long index, Map<String, Object> assignment, Long output) {
        this.index = index;
        this.assignment = assignment;
        this.output = output;
    }
}
