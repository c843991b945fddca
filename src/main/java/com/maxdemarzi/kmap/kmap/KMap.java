package com.maxdemarzi.kmap.kmap;

import com.maxdemarzi.kmap.quine.ExpressionedTruthTable;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.*;

/**
 * The value of every minterm index of a function: 0, 1 or don't-care, held in one array so
 * truth table, grid and don't-care flags cannot drift apart.
 * <p>
 * Functions of more than four variables keep their values but have no grid layout.
 */
public class KMap {
    private final List<String> variables;
    private final int numVars;
    private final CellValue[] cells;
    private final KMapLayout layout;

    public KMap(List<String> variables) {
        ExpressionedTruthTable.checkVariables(variables);
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.numVars = variables.size();
        this.cells = new CellValue[1 << numVars];
        this.layout = GrayCode.layout(numVars).orElse(null);
        reset();
    }

    public static KMap of(ExpressionedTruthTable table) {
        KMap kmap = new KMap(table.getVariables());
        kmap.paint(table.minTerms(), new RoaringBitmap());
        return kmap;
    }

    public static KMap of(List<String> variables, MintermList terms) {
        KMap kmap = new KMap(variables);
        kmap.paint(terms.getMinterms(), terms.getDontcares());
        return kmap;
    }

    public List<String> getVariables() {
        return variables;
    }

    public int getNumVars() {
        return numVars;
    }

    public int size() {
        return cells.length;
    }

    public Optional<KMapLayout> getLayout() {
        return Optional.ofNullable(layout);
    }

    public CellValue get(int index) {
        checkIndex(index);
        return cells[index];
    }

    public void set(int index, CellValue value) {
        checkIndex(index);
        cells[index] = Objects.requireNonNull(value, "value");
    }

    /** Flips 0 and 1. A don't-care becomes 1. */
    public CellValue toggle(int index) {
        CellValue value = get(index) == CellValue.ONE ? CellValue.ZERO : CellValue.ONE;
        cells[index] = value;
        return value;
    }

    /** 0 -> 1 -> d -> 0 */
    public CellValue cycle(int index) {
        CellValue value = get(index).next();
        cells[index] = value;
        return value;
    }

    public void reset() {
        Arrays.fill(cells, CellValue.ZERO);
    }

    /**
     * Clears the map, then marks minterms and don't-cares. Indices outside the map are ignored
     * and a term given in both sets ends up a don't-care.
     */
    public void paint(RoaringBitmap minterms, RoaringBitmap dontcares) {
        reset();
        mark(minterms, CellValue.ONE);
        mark(dontcares, CellValue.DONT_CARE);
    }

    public RoaringBitmap minterms() {
        return collect(CellValue.ONE);
    }

    public RoaringBitmap dontcares() {
        return collect(CellValue.DONT_CARE);
    }

    public RoaringBitmap zeros() {
        return collect(CellValue.ZERO);
    }

    /**
     * Every grid cell in row-major order.
     *
     * @throws IllegalStateException when the map has no layout
     */
    public List<Cell> cells() {
        if (layout == null) {
            throw new IllegalStateException("No grid for " + numVars + " variables, only 1 to "
                    + GrayCode.MAX_GRID_VARIABLES + " are laid out");
        }
        List<Cell> result = new ArrayList<>(cells.length);
        for (int r = 0; r < layout.rowCount(); r++) {
            for (int c = 0; c < layout.columnCount(); c++) {
                int index = layout.index(r, c);
                result.add(new Cell(r, c, index, cells[index]));
            }
        }
        return result;
    }

    private void mark(RoaringBitmap terms, CellValue value) {
        IntIterator it = terms.getIntIterator();
        while (it.hasNext()) {
            int term = it.next();
            if (term >= 0 && term < cells.length) {
                cells[term] = value;
            }
        }
    }

    private RoaringBitmap collect(CellValue value) {
        RoaringBitmap terms = new RoaringBitmap();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == value) {
                terms.add(i);
            }
        }
        return terms;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= cells.length) {
            throw new IndexOutOfBoundsException("Minterm " + index + " is outside [0, " + cells.length + ")");
        }
    }
}
