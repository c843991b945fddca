package com.maxdemarzi.kmap.quine;

import com.maxdemarzi.kmap.parser.Evaluator;
import com.maxdemarzi.kmap.parser.Parser;
import com.maxdemarzi.kmap.parser.Token;
import org.eclipse.collections.api.bimap.BiMap;
import org.eclipse.collections.api.bimap.MutableBiMap;
import org.eclipse.collections.impl.bimap.mutable.HashBiMap;
import org.roaringbitmap.RoaringBitmap;

import java.util.*;

/**
 * The full function table of an expression. Variable 0 is the most significant bit of the
 * row index: row {@code m} gives variable {@code i} the value {@code (m >> (n-1-i)) & 1}.
 */
public class ExpressionedTruthTable {
    private final int numVariables;
    private final List<String> variables;
    private final List<TruthTableRow> rows;
    private final int numRows;
    private final List<Token> rpn;
    private final MutableBiMap<Integer, String> varMapping;

    /**
     * Parses the formula and takes its distinct letters, upper cased and sorted, as the variables.
     */
    public ExpressionedTruthTable(String formula) {
        this(extractVariables(formula), Parser.parse(formula));
    }

    /**
     * @param variables variable names in bit order, most significant first
     * @param rpn       postfix tokens, or {@code null} for a table that is 0 everywhere
     */
    public ExpressionedTruthTable(List<String> variables, List<Token> rpn) {
        checkVariables(variables);
        varMapping = new HashBiMap<>();
        int count = 0;
        for (String name : variables) {
            varMapping.put(count++, name);
        }

        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.rpn = rpn == null ? null : Collections.unmodifiableList(new ArrayList<>(rpn));
        numVariables = count;
        numRows = 1 << numVariables;
        rows = new ArrayList<>(numRows);
    }

    /**
     * Variable names are single letters A to Z, each used once, so at most 26 of them.
     *
     * @throws IllegalArgumentException for any other name or for a repeated one
     */
    public static void checkVariables(List<String> variables) {
        Objects.requireNonNull(variables, "variables");
        Set<String> seen = new HashSet<>();
        for (String name : variables) {
            if (name == null || name.length() != 1 || name.charAt(0) < 'A' || name.charAt(0) > 'Z') {
                throw new IllegalArgumentException("Variable names must be single letters A to Z, got " + name);
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Variable " + name + " appears more than once in " + variables);
            }
        }
    }

    public static List<String> extractVariables(String formula) {
        SortedSet<String> letters = new TreeSet<>();
        if (formula != null) {
            for (char c : formula.toCharArray()) {
                if ((c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')) {
                    letters.add(String.valueOf(Character.toUpperCase(c)));
                }
            }
        }
        return new ArrayList<>(letters);
    }

    /**
     * Evaluates every assignment, in index order.
     */
    public static List<TruthTableRow> enumerate(List<String> variables, List<Token> rpn) {
        ExpressionedTruthTable table = new ExpressionedTruthTable(variables, rpn);
        table.compute();
        return table.getRows();
    }

    public void compute() {
        rows.clear();
        for (int m = 0; m < numRows; m++) {
            Map<String, Boolean> env = new LinkedHashMap<>();
            for (int i = 0; i < numVariables; i++) {
                env.put(varMapping.get(i), ((m >> (numVariables - 1 - i)) & 1) == 1);
            }
            int output = rpn == null ? 0 : Evaluator.evaluate(rpn, env);
            rows.add(new TruthTableRow(m, env, output));
        }
    }

    public List<TruthTableRow> getRows() {
        if (rows.isEmpty()) {
            compute();
        }
        return Collections.unmodifiableList(rows);
    }

    public RoaringBitmap minTerms() {
        RoaringBitmap terms = new RoaringBitmap();
        for (TruthTableRow row : getRows()) {
            if (row.getOutput() == 1) {
                terms.add(row.getIndex());
            }
        }
        return terms;
    }

    public int variables() {
        return this.numVariables;
    }

    public List<String> getVariables() {
        return variables;
    }

    /** Bit position to variable name; {@code inverse()} gives the position of a name. */
    public BiMap<Integer, String> getMapping() {
        return this.varMapping;
    }

    public List<Token> getRPN() {
        return rpn;
    }
}
