package com.maxdemarzi.kmap.quine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.StringJoiner;

/**
 * Writes a set of implicants as a sum of products or a product of sums.
 * <p>
 * Terms come out in literal order, variable by variable: complemented before plain before
 * absent. Equal covers therefore always print the same, whatever order they were picked in.
 */
public class Renderer {

    public static final String DEFAULT_PRODUCT_CONNECTIVE = " * ";

    static final Comparator<Implicant> LITERAL_ORDER = (a, b) -> {
        int n = Math.min(a.getNumVars(), b.getNumVars());
        for (int i = 0; i < n; i++) {
            int diff = rank(a.bitAt(i)) - rank(b.bitAt(i));
            if (diff != 0) {
                return diff;
            }
        }
        return Integer.compare(a.getNumVars(), b.getNumVars());
    };

    private final String productConnective;

    public Renderer() {
        this(DEFAULT_PRODUCT_CONNECTIVE);
    }

    /**
     * @param productConnective placed between POS clauses, e.g. {@code " * "} or {@code " · "}
     */
    public Renderer(String productConnective) {
        this.productConnective = productConnective;
    }

    public String render(List<Implicant> implicants, List<String> names, Mode mode) {
        return mode == Mode.POS ? renderPOS(implicants, names) : renderSOP(implicants, names);
    }

    /** {@code 0} for no implicants. */
    public String renderSOP(List<Implicant> implicants, List<String> names) {
        if (implicants.isEmpty()) {
            return "0";
        }
        StringJoiner sop = new StringJoiner(" + ");
        for (Implicant implicant : sorted(implicants)) {
            sop.add(implicant.getProductTerm(names));
        }
        return sop.toString();
    }

    /**
     * Renders implicants of the zero rows as clauses. {@code 1} for no implicants, meaning the
     * function has no zero rows.
     */
    public String renderPOS(List<Implicant> implicants, List<String> names) {
        if (implicants.isEmpty()) {
            return "1";
        }
        StringJoiner pos = new StringJoiner(productConnective);
        for (Implicant implicant : sorted(implicants)) {
            pos.add(implicant.getSumTerm(names));
        }
        return pos.toString();
    }

    public String getProductConnective() {
        return productConnective;
    }

    private static List<Implicant> sorted(List<Implicant> implicants) {
        List<Implicant> copy = new ArrayList<>(implicants);
        copy.sort(LITERAL_ORDER);
        return copy;
    }

    private static int rank(char bit) {
        switch (bit) {
            case '0':
                return 0;
            case '1':
                return 1;
            default:
                return 2;
        }
    }
}
