package com.maxdemarzi.kmap.results;

public class CellResult {
    public final Long row;
    public final Long column;
    public final Long index;
    public final String value;
    public final Boolean dontcare;

    public CellResult(Long row, Long column, Long index, String value, Boolean dontcare) {
        this.row = row;
        this.column = column;
        this.index = index;
        this.value = value;
        this.dontcare = dontcare;
    }
}
