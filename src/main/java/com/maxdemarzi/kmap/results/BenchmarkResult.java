package com.maxdemarzi.kmap.results;

public class BenchmarkResult {
    public final Long variables;
    public final Long trials;
    public final Double averageMillis;
    public final Double maxMillis;

    public BenchmarkResult(Long variables, Long trials, Double averageMillis, Double maxMillis) {
        this.variables = variables;
        this.trials = trials;
        this.averageMillis = averageMillis;
        this.maxMillis = maxMillis;
    }
}
