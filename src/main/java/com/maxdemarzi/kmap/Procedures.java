package com.maxdemarzi.kmap;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.maxdemarzi.kmap.bench.BenchmarkReport;
import com.maxdemarzi.kmap.bench.QuineMcCluskeyBenchmark;
import com.maxdemarzi.kmap.kmap.Cell;
import com.maxdemarzi.kmap.kmap.GrayCode;
import com.maxdemarzi.kmap.kmap.KMap;
import com.maxdemarzi.kmap.kmap.MintermList;
import com.maxdemarzi.kmap.quine.*;
import com.maxdemarzi.kmap.results.BenchmarkResult;
import com.maxdemarzi.kmap.results.CellResult;
import com.maxdemarzi.kmap.results.SimplifyResult;
import com.maxdemarzi.kmap.results.TruthRowResult;
import org.apache.commons.lang3.tuple.Pair;
import org.neo4j.logging.Log;
import org.neo4j.procedure.Context;
import org.neo4j.procedure.Description;
import org.neo4j.procedure.Name;
import org.neo4j.procedure.Procedure;
import org.neo4j.procedure.UserFunction;
import org.roaringbitmap.RoaringBitmap;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class Procedures {

    // This gives us a log instance that outputs messages to the
    // standard log, normally found under `data/log/neo4j.log`
    @Context
    public Log log;

    private static final Simplifier SIMPLIFIER = new Simplifier();

    // This cache stores simplified expressions by Expression and Mode
    public static final LoadingCache<Pair<String, Mode>, SimplifyResult> expressionCache = Caffeine.newBuilder()
            .expireAfterAccess(60, TimeUnit.MINUTES)
            .maximumSize(10_000)
            .build(Procedures::simplifyExpression);

    static SimplifyResult simplifyExpression(Pair<String, Mode> key) {
        ExpressionedTruthTable table = new ExpressionedTruthTable(key.getLeft());
        table.compute();
        return toResult(SIMPLIFIER.simplify(table, key.getRight()));
    }

    @Procedure(name = "com.maxdemarzi.kmap.simplify", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.kmap.simplify(expression, mode)")
    public Stream<SimplifyResult> simplify(
            @Name(value = "expression") String expression,
            @Name(value = "mode", defaultValue = "SOP") String mode) {

        Mode form = Mode.of(mode);
        SimplifyResult result = expressionCache.get(Pair.of(normalize(expression), form));
        log.debug("Simplified %s over %s as %s: %s", expression, result.variables, form, result.result);
        return Stream.of(result);
    }

    @Procedure(name = "com.maxdemarzi.kmap.truthTable", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.kmap.truthTable(expression)")
    public Stream<TruthRowResult> truthTable(@Name(value = "expression") String expression) {
        ExpressionedTruthTable table = new ExpressionedTruthTable(normalize(expression));
        table.compute();
        log.debug("Truth table of %s has %d rows", expression, table.getRows().size());

        return table.getRows().stream().map(row -> {
            Map<String, Object> assignment = new LinkedHashMap<>();
            row.getAssignment().forEach((name, value) -> assignment.put(name, value ? 1L : 0L));
            return new TruthRowResult((long) row.getIndex(), assignment, (long) row.getOutput());
        });
    }

    @Procedure(name = "com.maxdemarzi.kmap.minterms", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.kmap.minterms(terms, variables, mode, timeout)")
    public Stream<SimplifyResult> minterms(
            @Name(value = "terms") String terms,
            @Name(value = "variables") List<String> variables,
            @Name(value = "mode", defaultValue = "SOP") String mode,
            @Name(value = "timeout", defaultValue = "0") Long timeout) {

        MintermList list = MintermList.parse(terms);
        Mode form = Mode.of(mode);

        Simplification simplification;
        if (timeout != null && timeout > 0) {
            simplification = SIMPLIFIER.simplifyWithin(list.getMinterms(), list.getDontcares(), variables, form,
                    Duration.ofMillis(timeout));
        } else {
            simplification = SIMPLIFIER.simplify(list.getMinterms(), list.getDontcares(), variables, form);
        }
        log.debug("Simplified terms %s over %s as %s: %s", terms, variables, form, simplification.getText());
        return Stream.of(toResult(simplification));
    }

    @Procedure(name = "com.maxdemarzi.kmap.grid", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.kmap.grid(terms, variables)")
    public Stream<CellResult> grid(
            @Name(value = "terms") String terms,
            @Name(value = "variables") List<String> variables) {

        KMap kmap = KMap.of(variables, MintermList.parse(terms));
        List<Cell> cells = kmap.cells();
        log.debug("Laid out %d cells for %s", cells.size(), variables);

        return cells.stream().map(cell -> new CellResult((long) cell.getRow(), (long) cell.getColumn(),
                (long) cell.getIndex(), cell.getValue().getSymbol(), cell.isDontCare()));
    }

    @Procedure(name = "com.maxdemarzi.kmap.benchmark", mode = org.neo4j.procedure.Mode.READ)
    @Description("CALL com.maxdemarzi.kmap.benchmark(variables, trials, density, seed)")
    public Stream<BenchmarkResult> benchmark(
            @Name(value = "variables", defaultValue = "4") Long variables,
            @Name(value = "trials", defaultValue = "20") Long trials,
            @Name(value = "density", defaultValue = "0.28") Double density,
            @Name(value = "seed", defaultValue = "0") Long seed) {

        BenchmarkReport report = new QuineMcCluskeyBenchmark(seed, true)
                .run(variables.intValue(), trials.intValue(), density);
        log.debug(report.toString());

        return Stream.of(new BenchmarkResult((long) report.getVariables(), (long) report.getTrials(),
                report.getAverageMillis(), report.getMaxMillis()));
    }

    @UserFunction(name = "com.maxdemarzi.kmap.formatMinterms")
    @Description("RETURN com.maxdemarzi.kmap.formatMinterms(minterms, dontcares)")
    public String formatMinterms(
            @Name(value = "minterms") List<Long> minterms,
            @Name(value = "dontcares", defaultValue = "[]") List<Long> dontcares) {
        return MintermList.format(toBitmap(minterms), toBitmap(dontcares));
    }

    static SimplifyResult toResult(Simplification simplification) {
        List<String> implicants = simplification.getImplicants().stream()
                .map(Implicant::getBits)
                .collect(Collectors.toList());
        int n = simplification.getVariables().size();
        return new SimplifyResult(simplification.getVariables(), toList(simplification.getMinterms()),
                toList(simplification.getDontcares()), implicants, simplification.getMode().name(),
                simplification.getText(), n >= 1 && n <= GrayCode.MAX_GRID_VARIABLES);
    }

    private static String normalize(String expression) {
        return Objects.requireNonNull(expression, "expression").trim();
    }

    private static List<Long> toList(RoaringBitmap terms) {
        List<Long> list = new ArrayList<>(terms.getCardinality());
        for (int term : terms.toArray()) {
            list.add((long) term);
        }
        return list;
    }

    static RoaringBitmap toBitmap(List<Long> terms) {
        RoaringBitmap bitmap = new RoaringBitmap();
        if (terms != null) {
            for (Long term : terms) {
                if (term == null || term < 0 || term > Integer.MAX_VALUE) {
                    throw new InvalidTermException("Terms must be between 0 and " + Integer.MAX_VALUE + ", got " + term);
                }
                bitmap.add(term.intValue());
            }
        }
        return bitmap;
    }
}
