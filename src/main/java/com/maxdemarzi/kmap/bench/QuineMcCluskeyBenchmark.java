package com.maxdemarzi.kmap.bench;

import com.maxdemarzi.kmap.quine.QuineMcCluskey;
import org.roaringbitmap.RoaringBitmap;

import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.LongStream;

/**
 * Times the minimizer on random term sets. Each trial draws its own set from a generator
 * seeded with {@code seed + trial}, so a run is reproducible and trials can run in parallel.
 */
public class QuineMcCluskeyBenchmark {

    public static final int MIN_VARIABLES = 2;
    public static final int MAX_VARIABLES = 6;
    public static final int DEFAULT_VARIABLES = 4;
    public static final int DEFAULT_TRIALS = 20;
    public static final double DEFAULT_DENSITY = 0.28;

    private final long seed;
    private final boolean parallel;

    public QuineMcCluskeyBenchmark(long seed, boolean parallel) {
        this.seed = seed;
        this.parallel = parallel;
    }

    /**
     * @param variables variable count, anything outside 2..6 falls back to 4
     * @param trials    number of random term sets, anything below 1 falls back to 20
     * @param density   chance of each index being a minterm, outside (0, 1] falls back to 0.28
     */
    public BenchmarkReport run(int variables, int trials, double density) {
        int n = variables < MIN_VARIABLES || variables > MAX_VARIABLES ? DEFAULT_VARIABLES : variables;
        int count = trials < 1 ? DEFAULT_TRIALS : trials;
        double p = density <= 0 || density > 1 ? DEFAULT_DENSITY : density;

        IntStream runs = IntStream.range(0, count);
        if (parallel) {
            runs = runs.parallel();
        }
        long[] nanos = runs.mapToLong(t -> trial(n, p, new Random(seed + t))).toArray();
        return new BenchmarkReport(n, count, LongStream.of(nanos).average().orElse(0) / 1_000_000.0,
                LongStream.of(nanos).max().orElse(0) / 1_000_000.0);
    }

    static RoaringBitmap randomTerms(int n, double density, Random random) {
        RoaringBitmap terms = new RoaringBitmap();
        for (int i = 0; i < (1 << n); i++) {
            if (random.nextDouble() < density) {
                terms.add(i);
            }
        }
        return terms;
    }

    private static long trial(int n, double density, Random random) {
        RoaringBitmap terms = randomTerms(n, density, random);
        long start = System.nanoTime();
        QuineMcCluskey.minimize(terms, new RoaringBitmap(), n);
        return System.nanoTime() - start;
    }
}
