package com.maxdemarzi.kmap.quine;

import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one simplification: the inputs, the chosen implicants and their rendering.
 * For POS the implicants cover the zero rows.
 */
public class Simplification {
    private final Mode mode;
    private final List<String> variables;
    private final RoaringBitmap minterms;
    private final RoaringBitmap dontcares;
    private final List<Implicant> implicants;
    private final String text;

    public Simplification(Mode mode, List<String> variables, RoaringBitmap minterms, RoaringBitmap dontcares,
                          List<Implicant> implicants, String text) {
        this.mode = mode;
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.minterms = minterms.clone();
        this.dontcares = dontcares.clone();
        this.implicants = Collections.unmodifiableList(new ArrayList<>(implicants));
        this.text = text;
    }

    public Mode getMode() {
        return mode;
    }

    public List<String> getVariables() {
        return variables;
    }

    public RoaringBitmap getMinterms() {
        return minterms.clone();
    }

    public RoaringBitmap getDontcares() {
        return dontcares.clone();
    }

    public List<Implicant> getImplicants() {
        return implicants;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return mode + ": " + text;
    }
}
