package com.maxdemarzi.kmap.kmap;

import java.util.Optional;

/**
 * Reflected binary orderings and the Karnaugh map layouts built from them.
 */
public final class GrayCode {

    public static final int MAX_GRID_VARIABLES = 4;

    private GrayCode() {}

    /** The 2^bits codes in reflected binary order, e.g. [0,1,3,2] for two bits. */
    public static int[] sequence(int bits) {
        if (bits < 0 || bits > 30) {
            throw new IllegalArgumentException("Bit count must be between 0 and 30, got " + bits);
        }
        int[] codes = new int[1 << bits];
        for (int i = 0; i < codes.length; i++) {
            codes[i] = i ^ (i >> 1);
        }
        return codes;
    }

    /**
     * Rows take the leading variables: 1/0 for one variable, 1/1 for two, 1/2 for three and
     * 2/2 for four. Empty for zero or more than four variables.
     */
    public static Optional<KMapLayout> layout(int numVars) {
        switch (numVars) {
            case 1:
                return Optional.of(new KMapLayout(1, 0));
            case 2:
                return Optional.of(new KMapLayout(1, 1));
            case 3:
                return Optional.of(new KMapLayout(1, 2));
            case 4:
                return Optional.of(new KMapLayout(2, 2));
            default:
                return Optional.empty();
        }
    }
}
