package com.maxdemarzi.kmap;

import com.maxdemarzi.kmap.quine.InvalidTermException;
import org.junit.jupiter.api.*;
import org.neo4j.driver.*;
import org.neo4j.driver.Record;
import org.neo4j.driver.exceptions.ClientException;
import org.neo4j.harness.Neo4j;
import org.neo4j.harness.Neo4jBuilders;
import org.roaringbitmap.RoaringBitmap;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProceduresTests {

    private static Neo4j neo4j;
    private static Driver driver;

    @BeforeAll
    static void initialize() {
        neo4j = Neo4jBuilders.newInProcessBuilder()
                // disabling http server to speed up start
                .withDisabledServer()
                .withProcedure(Procedures.class)
                .withFunction(Procedures.class)
                .build();
        driver = GraphDatabase.driver(neo4j.boltURI(), Config.builder().withoutEncryption().build());
    }

    @AfterAll
    static void stopNeo4j() {
        driver.close();
        neo4j.close();
    }

    @Test
    void shouldSimplifyExpression() {
        try (Session session = driver.session()) {
            Record record = session.run("CALL com.maxdemarzi.kmap.simplify($expression)",
                    Values.parameters("expression", "A'B + AC")).single();

            assertEquals("A'B + AC", record.get("result").asString());
            assertEquals("SOP", record.get("mode").asString());
            assertThat(record.get("variables").asList(Value::asString)).containsExactly("A", "B", "C");
            assertThat(record.get("minterms").asList(Value::asLong)).containsExactly(2L, 3L, 5L, 7L);
            assertThat(record.get("implicants").asList(Value::asString)).containsExactlyInAnyOrder("01-", "1-1");
            assertTrue(record.get("grid").asBoolean());
        }
    }

    @Test
    void shouldSimplifyToProductOfSums() {
        try (Session session = driver.session()) {
            Record record = session.run("CALL com.maxdemarzi.kmap.simplify($expression, 'pos')",
                    Values.parameters("expression", "AB + AC")).single();

            assertEquals("A * (B + C)", record.get("result").asString());
            assertEquals("POS", record.get("mode").asString());
        }
    }

    @Test
    void shouldSimplifyMintermsWithDontCares() {
        try (Session session = driver.session()) {
            Record record = session.run("CALL com.maxdemarzi.kmap.minterms($terms, $variables)",
                    Values.parameters("terms", "1,3,d2", "variables", Arrays.asList("A", "B"))).single();

            assertEquals("B", record.get("result").asString());
            assertThat(record.get("dontcares").asList(Value::asLong)).containsExactly(2L);

            record = session.run("CALL com.maxdemarzi.kmap.minterms($terms, $variables, 'SOP', 5000)",
                    Values.parameters("terms", "2,3,5,7", "variables", Arrays.asList("A", "B", "C"))).single();
            assertEquals("A'B + AC", record.get("result").asString());
        }
    }

    @Test
    void shouldLayOutGrid() {
        try (Session session = driver.session()) {
            List<Record> records = session.run("CALL com.maxdemarzi.kmap.grid($terms, $variables)",
                    Values.parameters("terms", "15,d8", "variables", Arrays.asList("A", "B", "C", "D"))).list();

            assertEquals(16, records.size());
            Record last = records.get(10);
            assertEquals(15L, last.get("index").asLong());
            assertEquals(2L, last.get("row").asLong());
            assertEquals(2L, last.get("column").asLong());
            assertEquals("1", last.get("value").asString());

            Record dontcare = records.get(12);
            assertEquals(8L, dontcare.get("index").asLong());
            assertTrue(dontcare.get("dontcare").asBoolean());
        }
    }

    @Test
    void shouldListTruthTable() {
        try (Session session = driver.session()) {
            List<Record> records = session.run("CALL com.maxdemarzi.kmap.truthTable('A ^ B')").list();

            assertEquals(4, records.size());
            Map<String, Object> assignment = records.get(2).get("assignment").asMap();
            assertEquals(1L, assignment.get("A"));
            assertEquals(0L, assignment.get("B"));
            assertEquals(1L, records.get(2).get("output").asLong());
            assertEquals(0L, records.get(3).get("output").asLong());
        }
    }

    @Test
    void shouldBenchmark() {
        try (Session session = driver.session()) {
            Record record = session.run("CALL com.maxdemarzi.kmap.benchmark(3, 5)").single();

            assertEquals(3L, record.get("variables").asLong());
            assertEquals(5L, record.get("trials").asLong());
            assertFalse(record.get("averageMillis").isNull());
        }
    }

    @Test
    void shouldFormatMinterms() {
        try (Session session = driver.session()) {
            Record record = session.run("RETURN com.maxdemarzi.kmap.formatMinterms([3, 1], [4]) AS terms").single();
            assertEquals("1,3,d4", record.get("terms").asString());

            record = session.run("RETURN com.maxdemarzi.kmap.formatMinterms($terms) AS terms",
                    Values.parameters("terms", Collections.singletonList(0L))).single();
            assertEquals("0", record.get("terms").asString());
        }
    }

    @Test
    void shouldReportUnbalancedParentheses() {
        try (Session session = driver.session()) {
            assertThatThrownBy(() -> session.run("CALL com.maxdemarzi.kmap.simplify('(A+B')").consume())
                    .isInstanceOf(ClientException.class)
                    .hasMessageContaining("Unbalanced parentheses");
        }
    }

    @Test
    void shouldRejectMintermsOutsideVariableRange() {
        try (Session session = driver.session()) {
            assertThatThrownBy(() -> session.run("CALL com.maxdemarzi.kmap.minterms($terms, $variables)",
                    Values.parameters("terms", "1,9", "variables", Arrays.asList("A", "B"))).consume())
                    .isInstanceOf(ClientException.class)
                    .hasMessageContaining("Term 9 is outside [0, 4)");
        }
    }

    @Test
    void shouldRejectRepeatedVariables() {
        try (Session session = driver.session()) {
            assertThatThrownBy(() -> session.run("CALL com.maxdemarzi.kmap.minterms($terms, $variables)",
                    Values.parameters("terms", "0,1,2", "variables", Arrays.asList("A", "A"))).consume())
                    .isInstanceOf(ClientException.class)
                    .hasMessageContaining("Variable A appears more than once");

            assertThatThrownBy(() -> session.run("CALL com.maxdemarzi.kmap.grid($terms, $variables)",
                    Values.parameters("terms", "1", "variables", Arrays.asList("A", "bc"))).list())
                    .isInstanceOf(ClientException.class)
                    .hasMessageContaining("single letters A to Z");
        }
    }

    @Test
    void shouldRejectTermsThatDoNotFitAnInt() {
        try (Session session = driver.session()) {
            assertThatThrownBy(() -> session.run("RETURN com.maxdemarzi.kmap.formatMinterms([-1, 4294967297], []) AS terms").consume())
                    .isInstanceOf(ClientException.class)
                    .hasMessageContaining("Terms must be between 0 and 2147483647");
        }
    }

    @Test
    void shouldConvertTermLists() {
        RoaringBitmap terms = Procedures.toBitmap(Arrays.asList(5L, 0L, (long) Integer.MAX_VALUE));
        assertThat(terms.toArray()).containsExactly(0, 5, Integer.MAX_VALUE);
        assertThat(Procedures.toBitmap(null).isEmpty()).isTrue();

        assertThatThrownBy(() -> Procedures.toBitmap(Collections.singletonList(-1L)))
                .isInstanceOf(InvalidTermException.class);
        assertThatThrownBy(() -> Procedures.toBitmap(Collections.singletonList(4294967297L)))
                .isInstanceOf(InvalidTermException.class);
        assertThatThrownBy(() -> Procedures.toBitmap(Arrays.asList(3L, null)))
                .isInstanceOf(InvalidTermException.class);
    }
}
