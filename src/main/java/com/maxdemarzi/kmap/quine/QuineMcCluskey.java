package com.maxdemarzi.kmap.quine;

import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.primitive.MutableIntObjectMap;
import org.eclipse.collections.impl.list.mutable.primitive.IntArrayList;
import org.eclipse.collections.impl.map.mutable.primitive.IntObjectHashMap;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.*;

/**
 * Quine-McCluskey minimization with don't-cares.
 * <p>
 * Run the stages in order, or call {@link #minimize(RoaringBitmap, RoaringBitmap, int)}:
 * <ol>
 *   <li>{@link #doTabulation()} merges terms level by level and collects the prime implicants</li>
 *   <li>{@link #doCoveringChart()} relates every required term to the primes covering it</li>
 *   <li>{@link #doEssentialSelection()} picks primes that are the only cover of some term</li>
 *   <li>{@link #doGreedyCover()} adds the prime covering most uncovered terms until none are left</li>
 * </ol>
 * The greedy stage is a heuristic: it can miss a smaller cover that an exact search (Petrick's
 * method) would find. Ties go to the prime discovered first.
 * <p>
 * An instance holds the working state of a single call and is not thread safe. Separate
 * instances share nothing, so independent minimizations may run in parallel.
 */
public class QuineMcCluskey {

    private final RoaringBitmap required;
    private final RoaringBitmap dontcares;
    private final int numVars;

    // every implicant produced during tabulation, addressed by index
    private final List<Entry> arena = new ArrayList<>();
    private final List<Implicant> primes = new ArrayList<>();
    private final List<RoaringBitmap> primeCoverage = new ArrayList<>();
    private final MutableIntObjectMap<RoaringBitmap> chart = new IntObjectHashMap<>();
    private final MutableIntList chosen = new IntArrayList();
    private final RoaringBitmap chosenSet = new RoaringBitmap();
    private final RoaringBitmap covered = new RoaringBitmap();
    private int essentialCount;

    public QuineMcCluskey(RoaringBitmap required, RoaringBitmap dontcares, int numVars) {
        validate(required, dontcares, numVars);
        this.required = required.clone();
        this.dontcares = dontcares.clone();
        this.numVars = numVars;
    }

    public static List<Implicant> minimize(RoaringBitmap required, RoaringBitmap dontcares, int numVars) {
        QuineMcCluskey qm = new QuineMcCluskey(required, dontcares, numVars);
        if (required.isEmpty()) {
            return Collections.emptyList();
        }
        qm.doTabulation();
        qm.doCoveringChart();
        qm.doEssentialSelection();
        qm.doGreedyCover();
        return qm.getSelection();
    }

    public static List<Implicant> minimize(int[] required, int[] dontcares, int numVars) {
        return minimize(toBitmap(required, numVars), toBitmap(dontcares, numVars), numVars);
    }

    /**
     * Checks that every term lies in [0, 2^numVars) and that no term is both required and don't-care.
     */
    public static void validate(RoaringBitmap required, RoaringBitmap dontcares, int numVars) {
        Objects.requireNonNull(required, "required");
        Objects.requireNonNull(dontcares, "dontcares");
        Implicant.checkWidth(numVars);
        long limit = 1L << numVars;
        // roaring orders ints as unsigned, so a negative term sorts last
        for (RoaringBitmap terms : Arrays.asList(required, dontcares)) {
            if (!terms.isEmpty() && Integer.toUnsignedLong(terms.last()) >= limit) {
                throw new InvalidTermException(terms.last(), numVars);
            }
        }
        if (RoaringBitmap.intersects(required, dontcares)) {
            RoaringBitmap both = RoaringBitmap.and(required, dontcares);
            throw new InvalidTermException("Terms " + Arrays.toString(both.toArray()) + " are both required and don't-care");
        }
    }

    public void doTabulation() {
        arena.clear();
        primes.clear();

        TreeMap<Integer, List<Integer>> groups = new TreeMap<>();
        RoaringBitmap all = RoaringBitmap.or(required, dontcares);
        IntIterator it = all.getIntIterator();
        while (it.hasNext()) {
            int term = it.next();
            int index = add(new Implicant(term, numVars, dontcares.contains(term)));
            groups.computeIfAbsent(arena.get(index).implicant.getOnes(), k -> new ArrayList<>()).add(index);
        }

        Set<Implicant> seenPrimes = new HashSet<>();
        boolean anyCombined = true;
        while (anyCombined) {
            anyCombined = false;
            TreeMap<Integer, List<Integer>> next = new TreeMap<>();
            Set<Pair<Implicant, RoaringBitmap>> seen = new HashSet<>();

            List<Integer> keys = new ArrayList<>(groups.keySet());
            for (int k = 0; k < keys.size() - 1; k++) {
                if (keys.get(k + 1) - keys.get(k) != 1) {
                    continue;
                }
                for (int a : groups.get(keys.get(k))) {
                    for (int b : groups.get(keys.get(k + 1))) {
                        Entry left = arena.get(a);
                        Entry right = arena.get(b);
                        if (!left.implicant.canCombine(right.implicant)) {
                            continue;
                        }
                        Implicant merged = left.implicant.combine(right.implicant);
                        left.used = true;
                        right.used = true;
                        anyCombined = true;
                        if (seen.add(Pair.of(merged, merged.getTerms()))) {
                            int index = add(merged);
                            next.computeIfAbsent(merged.getOnes(), x -> new ArrayList<>()).add(index);
                        }
                    }
                }
            }

            for (List<Integer> group : groups.values()) {
                for (int index : group) {
                    Entry entry = arena.get(index);
                    if (!entry.used && seenPrimes.add(entry.implicant)) {
                        primes.add(entry.implicant);
                    }
                }
            }
            groups = next;
        }
    }

    public void doCoveringChart() {
        chart.clear();
        primeCoverage.clear();
        for (int j = 0; j < primes.size(); j++) {
            primeCoverage.add(new RoaringBitmap());
        }
        IntIterator it = required.getIntIterator();
        while (it.hasNext()) {
            int term = it.next();
            RoaringBitmap cover = new RoaringBitmap();
            for (int j = 0; j < primes.size(); j++) {
                if (primes.get(j).covers(term)) {
                    cover.add(j);
                    primeCoverage.get(j).add(term);
                }
            }
            chart.put(term, cover);
        }
    }

    public void doEssentialSelection() {
        IntIterator it = required.getIntIterator();
        while (it.hasNext()) {
            RoaringBitmap cover = chart.get(it.next());
            if (cover != null && cover.getCardinality() == 1) {
                choose(cover.first());
            }
        }
        essentialCount = chosen.size();
    }

    public void doGreedyCover() {
        while (covered.getCardinality() < required.getCardinality()) {
            RoaringBitmap uncovered = RoaringBitmap.andNot(required, covered);
            int best = -1;
            int bestCount = 0;
            for (int j = 0; j < primes.size(); j++) {
                if (chosenSet.contains(j)) {
                    continue;
                }
                int count = RoaringBitmap.andCardinality(primeCoverage.get(j), uncovered);
                if (count > bestCount) {
                    bestCount = count;
                    best = j;
                }
            }
            if (best == -1) {
                break;
            }
            choose(best);
        }
    }

    /** Primes in discovery order: by merge level, then by bucket, then by insertion. */
    public List<Implicant> getPrimeImplicants() {
        return Collections.unmodifiableList(primes);
    }

    public List<Implicant> getEssentialImplicants() {
        return getSelection().subList(0, essentialCount);
    }

    /** Chosen primes, essentials first, in the order they were picked. */
    public List<Implicant> getSelection() {
        List<Implicant> selection = new ArrayList<>(chosen.size());
        chosen.each(j -> selection.add(primes.get(j)));
        return selection;
    }

    /** Indices of the primes covering a required term, empty for anything else. */
    public RoaringBitmap getCoveringPrimes(int term) {
        RoaringBitmap cover = chart.get(term);
        return cover == null ? new RoaringBitmap() : cover.clone();
    }

    public int getNumVars() {
        return numVars;
    }

    private void choose(int prime) {
        if (chosenSet.checkedAdd(prime)) {
            chosen.add(prime);
            covered.or(primeCoverage.get(prime));
        }
    }

    private int add(Implicant implicant) {
        arena.add(new Entry(implicant));
        return arena.size() - 1;
    }

    private static RoaringBitmap toBitmap(int[] terms, int numVars) {
        RoaringBitmap bitmap = new RoaringBitmap();
        for (int term : terms) {
            if (term < 0) {
                throw new InvalidTermException(term, numVars);
            }
            bitmap.add(term);
        }
        return bitmap;
    }

    private static final class Entry {
        final Implicant implicant;
        boolean used;

        Entry(Implicant implicant) {
            this.implicant = implicant;
        }
    }
}
