package com.maxdemarzi.kmap.quine;

import com.maxdemarzi.kmap.kmap.MintermList;
import com.maxdemarzi.kmap.parser.Lexer;
import com.maxdemarzi.kmap.parser.Parser;
import com.maxdemarzi.kmap.parser.UnbalancedParenException;
import org.junit.jupiter.api.Test;
import org.roaringbitmap.RoaringBitmap;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class SimplifierTests {

    private static final List<String> AB = Arrays.asList("A", "B");
    private static final List<String> ABCD = Arrays.asList("A", "B", "C", "D");

    private final Simplifier simplifier = new Simplifier();

    private Simplification simplify(String expression, Mode mode) {
        ExpressionedTruthTable table = new ExpressionedTruthTable(expression);
        table.compute();
        return simplifier.simplify(table, mode);
    }

    @Test
    void shouldSimplifyExpressionToItself() {
        Simplification result = simplify("A'B + AC", Mode.SOP);
        assertThat(result.getVariables()).containsExactly("A", "B", "C");
        assertThat(result.getMinterms().toArray()).containsExactly(2, 3, 5, 7);
        assertEquals("A'B + AC", result.getText());
    }

    @Test
    void shouldDistributeAnd() {
        Simplification result = simplify("A(B+C)", Mode.SOP);
        assertThat(result.getMinterms().toArray()).containsExactly(5, 6, 7);
        assertEquals("AB + AC", result.getText());
    }

    @Test
    void shouldFailOnUnbalancedInput() {
        assertThat(Lexer.tokenize("(A+B")).isNotEmpty();
        assertThatThrownBy(() -> simplify("(A+B", Mode.SOP)).isInstanceOf(UnbalancedParenException.class);
    }

    @Test
    void shouldSimplifyImportedMinterms() {
        MintermList terms = MintermList.parse("4,5,6,7,12,13,14,15");
        Simplification result = simplifier.simplify(terms.getMinterms(), terms.getDontcares(), ABCD, Mode.SOP);
        assertEquals("B", result.getText());
        assertThat(result.getImplicants()).extracting(Implicant::getBits).containsExactly("-1--");
    }

    @Test
    void shouldRenderProductOfSums() {
        Simplification result = simplify("A(B+C)", Mode.POS);
        assertEquals(Mode.POS, result.getMode());
        assertEquals("A * (B + C)", result.getText());
        assertThat(result.getMinterms().toArray()).containsExactly(5, 6, 7);
    }

    @Test
    void shouldUseDontCaresInProductOfSums() {
        Simplification result = simplifier.simplify(RoaringBitmap.bitmapOf(1, 3), RoaringBitmap.bitmapOf(2), AB, Mode.POS);
        assertEquals("B", result.getText());
        assertThat(result.getDontcares().toArray()).containsExactly(2);
    }

    @Test
    void shouldRenderConstantFunctions() {
        assertEquals("1", simplify("A + A'", Mode.SOP).getText());
        assertEquals("1", simplify("A + A'", Mode.POS).getText());
        assertEquals("0", simplify("AA'", Mode.SOP).getText());
        assertEquals("0", simplify("AA'", Mode.POS).getText());
        assertEquals("1", simplify("1+0", Mode.SOP).getText());
        assertEquals("0", simplify("1^1", Mode.SOP).getText());
    }

    @Test
    void shouldAgreeBetweenSopAndPos() {
        Random random = new Random(5);
        for (int trial = 0; trial < 100; trial++) {
            RoaringBitmap minterms = new RoaringBitmap();
            for (int m = 0; m < 16; m++) {
                if (random.nextBoolean()) {
                    minterms.add(m);
                }
            }
            String sop = simplifier.simplify(minterms, new RoaringBitmap(), ABCD, Mode.SOP).getText();
            String pos = simplifier.simplify(minterms, new RoaringBitmap(), ABCD, Mode.POS).getText();
            assertEquals(minterms, new ExpressionedTruthTable(ABCD, Parser.parse(sop)).minTerms(), sop);
            assertEquals(minterms, new ExpressionedTruthTable(ABCD, Parser.parse(pos)).minTerms(), pos);
        }
    }

    @Test
    void shouldRejectOverlappingTerms() {
        assertThatThrownBy(() -> simplifier.simplify(RoaringBitmap.bitmapOf(1), RoaringBitmap.bitmapOf(1), AB, Mode.SOP))
                .isInstanceOf(InvalidTermException.class);
        assertThatThrownBy(() -> simplifier.simplify(RoaringBitmap.bitmapOf(4), new RoaringBitmap(), AB, Mode.POS))
                .isInstanceOf(InvalidTermException.class);
    }

    @Test
    void shouldFinishWithinBudget() {
        Simplification result = simplifier.simplifyWithin(RoaringBitmap.bitmapOf(1, 3), new RoaringBitmap(), AB,
                Mode.SOP, Duration.ofSeconds(10));
        assertEquals("B", result.getText());
    }

    @Test
    void shouldPassFailuresThroughBudget() {
        assertThatThrownBy(() -> simplifier.simplifyWithin(RoaringBitmap.bitmapOf(1), RoaringBitmap.bitmapOf(1), AB,
                Mode.SOP, Duration.ofSeconds(10)))
                .isInstanceOf(InvalidTermException.class);
    }

    @Test
    void shouldTimeOutOnLargeInput() {
        Random random = new Random(1);
        RoaringBitmap minterms = new RoaringBitmap();
        for (int m = 0; m < (1 << 11); m++) {
            if (random.nextBoolean()) {
                minterms.add(m);
            }
        }
        List<String> names = Arrays.asList("A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K");
        assertThatThrownBy(() -> simplifier.simplifyWithin(minterms, new RoaringBitmap(), names, Mode.SOP,
                Duration.ofMillis(1)))
                .isInstanceOf(MinimizationTimeoutException.class);
    }

    @Test
    void shouldReportInterruptAsCancelled() {
        Random random = new Random(2);
        RoaringBitmap minterms = new RoaringBitmap();
        for (int m = 0; m < (1 << 11); m++) {
            if (random.nextBoolean()) {
                minterms.add(m);
            }
        }
        List<String> names = Arrays.asList("A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K");
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> simplifier.simplifyWithin(minterms, new RoaringBitmap(), names, Mode.SOP,
                    Duration.ofSeconds(30)))
                    .isInstanceOf(CancellationException.class)
                    .hasCauseInstanceOf(InterruptedException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldKeepVariablesWhenCallerListChanges() {
        List<String> names = new ArrayList<>(AB);
        Simplification simplification = simplifier.simplify(RoaringBitmap.bitmapOf(1, 3), new RoaringBitmap(),
                names, Mode.SOP);
        names.set(1, "C");
        names.add("D");
        assertThat(simplification.getVariables()).containsExactly("A", "B");
        assertEquals("B", simplification.getText());
    }

    @Test
    void shouldRejectRepeatedVariables() {
        assertThatThrownBy(() -> simplifier.simplify(RoaringBitmap.bitmapOf(0, 1, 2), new RoaringBitmap(),
                Arrays.asList("A", "A"), Mode.SOP))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("appears more than once");
    }
}
