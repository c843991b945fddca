package com.maxdemarzi.kmap.kmap;

/**
 * One grid position as a renderer sees it.
 */
public class Cell {
    private final int row;
    private final int column;
    private final int index;
    private final CellValue value;

    public Cell(int row, int column, int index, CellValue value) {
        this.row = row;
        this.column = column;
        this.index = index;
        this.value = value;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public int getIndex() {
        return index;
    }

    public CellValue getValue() {
        return value;
    }

    public boolean isDontCare() {
        return value == CellValue.DONT_CARE;
    }

    @Override
    public String toString() {
        return "m" + index + "(" + row + "," + column + ")=" + value.getSymbol();
    }
}
