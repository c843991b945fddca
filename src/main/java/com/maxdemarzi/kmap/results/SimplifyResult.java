package com.maxdemarzi.kmap.results;

import java.util.List;

public class SimplifyResult {
    public final List<String> variables;
    public final List<Long> minterms;
    public final List<Long> dontcares;
    public final List<String> implicants;
    public final String mode;
    public final String result;
    public final Boolean grid;

    public SimplifyResult(List<String> variables, List<Long> minterms, List<Long> dontcares,
                          List<String> implicants, String mode, String result, Boolean grid) {
        this.variables = variables;
        this.minterms = minterms;
        this.dontcares = dontcares;
        this.implicants = implicants;
        this.mode = mode;
        this.result = result;
        this.grid = grid;
    }
}
