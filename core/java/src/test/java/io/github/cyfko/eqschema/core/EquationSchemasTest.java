package io.github.cyfko.eqschema.core;

import io.github.cyfko.eqschema.core.EquationSchemas.DefaultEquationCanonicalizer;
import io.github.cyfko.eqschema.core.api.Equation;
import io.github.cyfko.eqschema.core.api.EquationCanonicalizer;
import io.github.cyfko.eqschema.core.api.EquationParser;
import io.github.cyfko.eqschema.core.api.ExpressionNode.Leaf;
import io.github.cyfko.eqschema.core.api.ExpressionNode.UnaryOp;
import io.github.cyfko.eqschema.core.api.OperatorKind;
import io.github.cyfko.eqschema.core.config.AliasTable;
import io.github.cyfko.eqschema.core.config.CachePolicy;
import io.github.cyfko.eqschema.core.config.EquationPolicy;
import io.github.cyfko.eqschema.core.exception.EquationFormatException;
import io.github.cyfko.eqschema.core.exception.LexException;
import io.github.cyfko.eqschema.core.exception.ParseException;
import io.github.cyfko.eqschema.core.impl.BasicEquationParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of the canonicalization pipeline and its result cache.
 */
@DisplayName("EquationSchemas Tests")
class EquationSchemasTest {

    @Nested
    @DisplayName("Canonical schemas")
    class ScenarioTests {

        @ParameterizedTest(name = "[{0}]")
        @DisplayName("Every spelling of a negated variable gives F=~A")
        @ValueSource(strings = {
            "F = NOT A", "F = not A", "F = ~A", "F = ~ A", "F = !A", "F = ! A",
            "F    =   NOT  A", "F=   not  A  ", "F  =    ~   A", "F=~A", "F = !    A   ", "F =      !A"
        })
        void testNegationSpellings(String raw) {
            assertEquals("F=~A", EquationSchemas.canonicalize(raw));
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @DisplayName("Binary operators and grouping")
        @CsvSource(delimiter = ';', value = {
            "F = A AND B;F=A&B",
            "F = A AND (B OR C);F=A&(B|C)",
            "F = A OR B OR C;F=A|B|C",
            "F = A or (B or C);F=A|(B|C)",
            "Out = (A xor B) and not C;Out=(A^B)&~C",
            "F = A * B + !C;F=A&B|~C",
            "F = NOT NOT A;F=~~A",
            "F = not (A and B);F=~(A&B)",
            "sum = a ^ b ^ cin;sum=a^b^cin"
        })
        void testBinaryScenarios(String raw, String expected) {
            assertEquals(expected, EquationSchemas.canonicalize(raw));
        }

        @Test
        @DisplayName("Leading binary operator is a parse error at its position")
        void testLeadingOperator() {
            ParseException ex = assertThrows(ParseException.class, () -> EquationSchemas.canonicalize("F = AND A"));

            assertEquals(4, ex.position());
            assertEquals("AND", ex.offendingText());
        }

        @Test
        @DisplayName("Error kinds reach the caller unchanged")
        void testErrorKinds() {
            assertThrows(LexException.class, () -> EquationSchemas.canonicalize("F = A # B"));
            assertThrows(EquationFormatException.class, () -> EquationSchemas.canonicalize("F = A = B"));
            assertThrows(EquationFormatException.class, () -> EquationSchemas.canonicalize(null));
        }

        @Test
        @DisplayName("Registered aliases flow through the facade")
        void testCustomAliases() {
            EquationPolicy policy = EquationPolicy.builder()
                    .aliasTable(AliasTable.builder().alias("Negate", OperatorKind.NOT).alias("&&", OperatorKind.AND).alias("||", OperatorKind.OR).build())
                    .build();

            assertEquals("F=~A&B|C", EquationSchemas.of(policy).canonicalize("F = Negate A && B || C"));
        }
    }

    @Nested
    @DisplayName("Properties")
    class PropertyTests {

        private final List<String> samples = List.of(
                "F = NOT A",
                "F = A AND (B OR C)",
                "F = (A OR B) AND (C XOR NOT D)",
                "G = not (x1 | (x2 & x3)) ^ ~~x4",
                "H = ((a)) or b or (c or d)"
        );

        @Test
        @DisplayName("Canonicalizing a canonical schema returns it unchanged")
        void testIdempotence() {
            for (String sample : samples) {
                String canonical = EquationSchemas.canonicalize(sample);
                assertEquals(canonical, EquationSchemas.canonicalize(canonical), sample);
            }
        }

        @Test
        @DisplayName("Whitespace between tokens does not matter")
        void testWhitespaceInvariance() {
            for (String sample : samples) {
                String spaced = sample.replace("(", " ( ").replace(")", " ) ").replace("=", "\t=\t");
                assertEquals(EquationSchemas.canonicalize(sample), EquationSchemas.canonicalize("  " + spaced + "  "), sample);
            }
        }

        @Test
        @DisplayName("Operator spellings are interchangeable")
        void testAliasEquivalence() {
            String expected = "F=~A&B^C|D";

            assertEquals(expected, EquationSchemas.canonicalize("F = NOT A AND B XOR C OR D"));
            assertEquals(expected, EquationSchemas.canonicalize("F = not A and B xor C or D"));
            assertEquals(expected, EquationSchemas.canonicalize("F = !A * B ^ C + D"));
            assertEquals(expected, EquationSchemas.canonicalize("F = ~A & B ^ C | D"));
        }

        @Test
        @DisplayName("Re-parsing the canonical schema yields the same equation")
        void testRoundTrip() {
            EquationParser parser = new BasicEquationParser();
            for (String sample : samples) {
                Equation equation = parser.parse(sample);
                assertEquals(equation, parser.parse(equation.toCanonicalString()), sample);
            }
        }
    }

    @Nested
    @DisplayName("Result cache")
    class CacheTests {

        @Mock
        private EquationParser mockParser;

        private final Equation notA = new Equation("F", new UnaryOp(OperatorKind.NOT, new Leaf("A")));

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
        }

        @Test
        @DisplayName("Repeated input is parsed once")
        void testCacheHit() {
            when(mockParser.parse("F = NOT A")).thenReturn(notA);
            DefaultEquationCanonicalizer canonicalizer = new DefaultEquationCanonicalizer(mockParser, CachePolicy.defaults());

            assertEquals("F=~A", canonicalizer.canonicalize("F = NOT A"));
            assertEquals("F=~A", canonicalizer.canonicalize("F = NOT A"));

            verify(mockParser, times(1)).parse("F = NOT A");
            Map<String, Object> stats = canonicalizer.getCacheStats();
            assertEquals(true, stats.get("enabled"));
            assertEquals(1, stats.get("size"));
            assertEquals(1L, stats.get("hits"));
            assertEquals(1L, stats.get("misses"));
        }

        @Test
        @DisplayName("Failures are not cached")
        void testFailureNotCached() {
            when(mockParser.parse("F = AND A")).thenThrow(new ParseException("Binary operator 'AND' at position 4 is missing its left operand", null, 4));
            DefaultEquationCanonicalizer canonicalizer = new DefaultEquationCanonicalizer(mockParser, CachePolicy.defaults());

            assertThrows(ParseException.class, () -> canonicalizer.canonicalize("F = AND A"));
            assertThrows(ParseException.class, () -> canonicalizer.canonicalize("F = AND A"));

            verify(mockParser, times(2)).parse("F = AND A");
            assertEquals(0, canonicalizer.getCacheStats().get("size"));
        }

        @Test
        @DisplayName("Disabled cache parses every call")
        void testCacheDisabled() {
            when(mockParser.parse(anyString())).thenReturn(notA);
            DefaultEquationCanonicalizer canonicalizer = new DefaultEquationCanonicalizer(mockParser, CachePolicy.none());

            canonicalizer.canonicalize("F = NOT A");
            canonicalizer.canonicalize("F = NOT A");
            canonicalizer.canonicalize("F = NOT A");

            verify(mockParser, times(3)).parse("F = NOT A");
            assertEquals(Map.of("enabled", false), canonicalizer.getCacheStats());
        }

        @Test
        @DisplayName("Cache is bounded by the policy size")
        void testCacheBound() {
            when(mockParser.parse(anyString())).thenReturn(notA);
            DefaultEquationCanonicalizer canonicalizer = new DefaultEquationCanonicalizer(mockParser, CachePolicy.custom(2));

            canonicalizer.canonicalize("F = NOT A");
            canonicalizer.canonicalize("F = not A");
            canonicalizer.canonicalize("F = ~A");

            assertEquals(2, canonicalizer.getCacheStats().get("size"));
            assertEquals(2, canonicalizer.getCacheStats().get("maxSize"));
        }

        @Test
        @DisplayName("parse() bypasses the cache")
        void testParseDelegates() {
            when(mockParser.parse("F = NOT A")).thenReturn(notA);
            EquationCanonicalizer canonicalizer = EquationSchemas.of(mockParser, CachePolicy.defaults());

            assertSame(notA, canonicalizer.parse("F = NOT A"));
            assertSame(notA, canonicalizer.parse("F = NOT A"));

            verify(mockParser, times(2)).parse("F = NOT A");
        }

        @Test
        @DisplayName("parseExpression() delegates to the parser")
        void testParseExpressionDelegates() {
            when(mockParser.parseExpression("NOT A")).thenReturn(notA.expression());
            EquationCanonicalizer canonicalizer = EquationSchemas.of(mockParser, CachePolicy.none());

            assertEquals(notA.expression(), canonicalizer.parseExpression("NOT A"));
            verify(mockParser).parseExpression("NOT A");
            verifyNoMoreInteractions(mockParser);
        }

        @Test
        @DisplayName("Concurrent callers get the same schema")
        void testConcurrentAccess() throws Exception {
            EquationCanonicalizer canonicalizer = EquationSchemas.of(EquationPolicy.defaults(), CachePolicy.custom(4));
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<String>> results = new ArrayList<>();

            try {
                for (int i = 0; i < threads * 10; i++) {
                    String raw = (i % 2 == 0) ? "F = A AND (B OR C)" : "F = A and (B or C)";
                    results.add(executor.submit(() -> {
                        start.await();
                        return canonicalizer.canonicalize(raw);
                    }));
                }
                start.countDown();

                for (Future<String> result : results) {
                    assertEquals("F=A&(B|C)", result.get(10, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("Factory arguments are required")
    void testNullArguments() {
        EquationParser parser = new BasicEquationParser();

        assertThrows(NullPointerException.class, () -> EquationSchemas.of((EquationParser) null, CachePolicy.defaults()));
        assertThrows(NullPointerException.class, () -> EquationSchemas.of(parser, null));
        assertThrows(IllegalArgumentException.class, () -> EquationSchemas.of((EquationPolicy) null));
    }
}
