package com.maxdemarzi.kmap.bench;

public class BenchmarkReport {
    private final int variables;
    private final int trials;
    private final double averageMillis;
    private final double maxMillis;

    public BenchmarkReport(int variables, int trials, double averageMillis, double maxMillis) {
        this.variables = variables;
        this.trials = trials;
        this.averageMillis = averageMillis;
        this.maxMillis = maxMillis;
    }

    public int getVariables() {
        return variables;
    }

    public int getTrials() {
        return trials;
    }

    public double getAverageMillis() {
        return averageMillis;
    }

    public double getMaxMillis() {
        return maxMillis;
    }

    @Override
    public String toString() {
        return String.format("QM (%d var, %d runs): avg %.2f ms, max %.2f ms", variables, trials, averageMillis, maxMillis);
    }
}
