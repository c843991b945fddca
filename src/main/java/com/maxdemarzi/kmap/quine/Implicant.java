package com.maxdemarzi.kmap.quine;

import org.roaringbitmap.RoaringBitmap;

import java.util.List;

/**
 * A product term over {@code numVars} variables, written as a bit string over {0,1,-}.
 * Character i of the bit string is variable i, which is bit {@code numVars - 1 - i}
 * of a minterm index.
 * <p>
 * Internally the term is a pair of masks: {@code myMask} holds the fixed positions and
 * {@code myValue} the bits at those positions. A dash is a position missing from the mask.
 */
public class Implicant {

    private final int myMask;
    private final int myValue;
    private final int myNumVars;
    private final RoaringBitmap minterms;
    private final RoaringBitmap dontcares;

    public Implicant(int minterm, int numVars, boolean dontcare) {
        checkWidth(numVars);
        if (minterm < 0 || (long) minterm >= (1L << numVars)) {
            throw new InvalidTermException(minterm, numVars);
        }
        myMask = fullMask(numVars);
        myValue = minterm;
        myNumVars = numVars;
        minterms = new RoaringBitmap();
        dontcares = new RoaringBitmap();
        if (dontcare)
            dontcares.add(minterm);
        else
            minterms.add(minterm);
    }

    private Implicant(int mask, int value, int numVars, RoaringBitmap minterms, RoaringBitmap dontcares) {
        myMask = mask;
        myValue = value;
        myNumVars = numVars;
        this.minterms = minterms;
        this.dontcares = dontcares;
    }

    /**
     * Parses a bit string such as {@code "1-0"}. The result has no contributing terms.
     */
    public static Implicant of(String bits) {
        int numVars = bits.length();
        checkWidth(numVars);
        int mask = 0;
        int value = 0;
        for (int i = 0; i < numVars; i++) {
            int bit = 1 << (numVars - 1 - i);
            char c = bits.charAt(i);
            if (c == '1') {
                mask |= bit;
                value |= bit;
            } else if (c == '0') {
                mask |= bit;
            } else if (c != '-') {
                throw new IllegalArgumentException("Implicants are written over {0,1,-}, got " + bits);
            }
        }
        return new Implicant(mask, value, numVars, new RoaringBitmap(), new RoaringBitmap());
    }

    public int getMask() {
        return myMask;
    }

    public int getValue() {
        return myValue;
    }

    public int getNumVars() {
        return myNumVars;
    }

    /** Required terms this implicant was merged from. */
    public RoaringBitmap getMinterms() {
        return minterms.clone();
    }

    /** Don't-care terms this implicant was merged from. */
    public RoaringBitmap getDontcares() {
        return dontcares.clone();
    }

    public RoaringBitmap getTerms() {
        return RoaringBitmap.or(minterms, dontcares);
    }

    /**
     * True when both terms fix the same positions and disagree on exactly one of them.
     * Identical terms never combine.
     */
    public boolean canCombine(Implicant other) {
        return other.myNumVars == myNumVars
                && other.myMask == myMask
                && Integer.bitCount(other.myValue ^ myValue) == 1;
    }

    public Implicant combine(Implicant other) {
        if (!canCombine(other)) {
            throw new IllegalArgumentException(getBits() + " and " + other.getBits() + " do not differ in exactly one bit");
        }
        int diff = myValue ^ other.myValue;
        return new Implicant(myMask & ~diff, myValue & ~diff, myNumVars,
                RoaringBitmap.or(minterms, other.minterms),
                RoaringBitmap.or(dontcares, other.dontcares));
    }

    /** Dashes match anything, fixed positions must agree with the minterm. */
    public boolean covers(int minterm) {
        return (minterm & myMask) == myValue;
    }

    /** Every minterm index matched by this term, ascending. */
    public RoaringBitmap coveredMinterms() {
        RoaringBitmap covered = new RoaringBitmap();
        int free = fullMask(myNumVars) & ~myMask;
        // walk every subset of the free positions
        int subset = 0;
        do {
            covered.add(myValue | subset);
            subset = (subset - free) & free;
        } while (subset != 0);
        return covered;
    }

    public int getOnes() {
        return Integer.bitCount(myValue);
    }

    public int getLiteralCount() {
        return Integer.bitCount(myMask);
    }

    /** The all-dash term, constant true. */
    public boolean isTautology() {
        return myMask == 0;
    }

    public char bitAt(int position) {
        int bit = 1 << (myNumVars - 1 - position);
        if ((myMask & bit) == 0) {
            return '-';
        }
        return (myValue & bit) != 0 ? '1' : '0';
    }

    public String getBits() {
        StringBuilder bits = new StringBuilder(myNumVars);
        for (int i = 0; i < myNumVars; i++) {
            bits.append(bitAt(i));
        }
        return bits.toString();
    }

    /**
     * Product of literals, {@code A'B} for {@code 01-}. Constant {@code 1} when no literal is left.
     */
    public String getProductTerm(List<String> names) {
        checkNames(names);
        StringBuilder expr = new StringBuilder();
        for (int i = 0; i < myNumVars; i++) {
            char c = bitAt(i);
            if (c == '1') {
                expr.append(names.get(i));
            } else if (c == '0') {
                expr.append(names.get(i)).append('\'');
            }
        }
        return expr.length() == 0 ? "1" : expr.toString();
    }

    /**
     * Sum clause with polarity flipped, {@code (A + B')} for {@code 01-}. A single literal is
     * left bare, and constant {@code 0} is returned when no literal is left.
     */
    public String getSumTerm(List<String> names) {
        checkNames(names);
        StringBuilder expr = new StringBuilder();
        int literals = 0;
        for (int i = 0; i < myNumVars; i++) {
            char c = bitAt(i);
            if (c == '-') {
                continue;
            }
            if (literals++ > 0) {
                expr.append(" + ");
            }
            expr.append(names.get(i));
            if (c == '1') {
                expr.append('\'');
            }
        }
        if (literals == 0) {
            return "0";
        }
        return literals == 1 ? expr.toString() : "(" + expr + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Implicant)) return false;
        Implicant imp = (Implicant) o;
        return (imp.myValue == this.myValue) &&
                (imp.myNumVars == this.myNumVars) &&
                (imp.myMask == this.myMask);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * myMask + myValue) + myNumVars;
    }

    @Override
    public String toString() {
        return getBits();
    }

    private void checkNames(List<String> names) {
        if (names.size() != myNumVars) {
            throw new IllegalArgumentException("Expected " + myNumVars + " variable names, got " + names);
        }
    }

    static int fullMask(int numVars) {
        return numVars == 0 ? 0 : -1 >>> (32 - numVars);
    }

    static void checkWidth(int numVars) {
        if (numVars < 0 || numVars > 30) {
            throw new IllegalArgumentException("Variable count must be between 0 and 30, got " + numVars);
        }
    }
}
