package com.maxdemarzi.kmap.quine;

import org.roaringbitmap.RoaringBitmap;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Minimizes a term assignment and renders it in the requested {@link Mode}. POS runs the same
 * minimizer over the zero rows (rows that are neither minterms nor don't-cares) and only
 * flips literal polarity when rendering.
 */
public class Simplifier {

    private final Renderer renderer;

    public Simplifier() {
        this(new Renderer());
    }

    public Simplifier(Renderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public Simplification simplify(ExpressionedTruthTable table, Mode mode) {
        return simplify(table.minTerms(), new RoaringBitmap(), table.getVariables(), mode);
    }

    public Simplification simplify(RoaringBitmap minterms, RoaringBitmap dontcares, List<String> variables, Mode mode) {
        ExpressionedTruthTable.checkVariables(variables);
        Objects.requireNonNull(mode, "mode");
        int n = variables.size();
        QuineMcCluskey.validate(minterms, dontcares, n);

        RoaringBitmap required = minterms;
        if (mode == Mode.POS) {
            required = RoaringBitmap.bitmapOfRange(0, 1L << n);
            required.andNot(minterms);
            required.andNot(dontcares);
        }
        List<Implicant> implicants = QuineMcCluskey.minimize(required, dontcares, n);
        return new Simplification(mode, variables, minterms, dontcares, implicants,
                renderer.render(implicants, variables, mode));
    }

    /**
     * Same as {@link #simplify(RoaringBitmap, RoaringBitmap, List, Mode)} but gives up after
     * {@code budget}. The abandoned call keeps running on the common pool until it finishes.
     *
     * @throws MinimizationTimeoutException when the budget runs out
     * @throws CancellationException when the calling thread is interrupted while waiting
     */
    public Simplification simplifyWithin(RoaringBitmap minterms, RoaringBitmap dontcares, List<String> variables,
                                         Mode mode, Duration budget) {
        CompletableFuture<Simplification> future =
                CompletableFuture.supplyAsync(() -> simplify(minterms, dontcares, variables, mode));
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new MinimizationTimeoutException(budget, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Minimization was interrupted");
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    public Renderer getRenderer() {
        return renderer;
    }
}
