package com.maxdemarzi.kmap.kmap;

/**
 * What a single minterm index is assigned to. A don't-care is never also a 1.
 */
public enum CellValue {
    ZERO("0"),
    ONE("1"),
    DONT_CARE("d");

    private final String symbol;

    CellValue(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /** 0 -> 1 -> d -> 0 */
    public CellValue next() {
        switch (this) {
            case ZERO:
                return ONE;
            case ONE:
                return DONT_CARE;
            default:
                return ZERO;
        }
    }
}
