package com.maxdemarzi.kmap.kmap;

import java.util.List;

/**
 * Row and column addressing of a Karnaugh map. Row bits are the high bits of a minterm index
 * and column bits the low bits, so {@code index(r, c) = rows[r] << columnBits | columns[c]}.
 * Neighbouring cells, including the ones across the wrap-around edges, differ in one bit.
 */
public class KMapLayout {
    private final int rowBits;
    private final int columnBits;
    private final int[] rows;
    private final int[] columns;

    KMapLayout(int rowBits, int columnBits) {
        this.rowBits = rowBits;
        this.columnBits = columnBits;
        this.rows = GrayCode.sequence(rowBits);
        this.columns = GrayCode.sequence(columnBits);
    }

    public int getRowBits() {
        return rowBits;
    }

    public int getColumnBits() {
        return columnBits;
    }

    public int getNumVars() {
        return rowBits + columnBits;
    }

    /** Row codes top to bottom. */
    public int[] getRows() {
        return rows.clone();
    }

    /** Column codes left to right. */
    public int[] getColumns() {
        return columns.clone();
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return columns.length;
    }

    public int index(int row, int column) {
        if (row < 0 || row >= rows.length || column < 0 || column >= columns.length) {
            throw new IndexOutOfBoundsException("Cell (" + row + ", " + column + ") is outside a "
                    + rows.length + "x" + columns.length + " map");
        }
        return (rows[row] << columnBits) | columns[column];
    }

    /** Inverse of {@link #index(int, int)}: {row, column} of a minterm. */
    public int[] position(int index) {
        int rowCode = index >> columnBits;
        int columnCode = index & ((1 << columnBits) - 1);
        return new int[]{find(rows, rowCode), find(columns, columnCode)};
    }

    public List<String> rowVariables(List<String> names) {
        return names.subList(0, rowBits);
    }

    public List<String> columnVariables(List<String> names) {
        return names.subList(rowBits, rowBits + columnBits);
    }

    private static int find(int[] codes, int code) {
        for (int i = 0; i < codes.length; i++) {
            if (codes[i] == code) {
                return i;
            }
        }
        throw new IndexOutOfBoundsException("Code " + code + " is not on this map");
    }
}
