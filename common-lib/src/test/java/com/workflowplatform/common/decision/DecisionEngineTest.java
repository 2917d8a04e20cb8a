package com.workflowplatform.common.decision;

import com.workflowplatform.common.exception.UnknownOperatorException;
import com.workflowplatform.common.model.DecisionConfig;
import com.workflowplatform.common.model.DecisionRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link DecisionEngine} rule semantics.
 */
class DecisionEngineTest {

    private final DecisionEngine engine = new DecisionEngine();

    private static DecisionConfig priceAndVolume(String combinator) {
        return DecisionConfig.of(combinator,
            DecisionRule.of("price", "gt", 100),
            DecisionRule.of("volume", "lt", 1000));
    }

    // ── Combinators ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("AND / OR combinators")
    class CombinatorTests {

        @Test
        @DisplayName("AND passes when every rule passes")
        void andAllPass() {
            DecisionResult result = engine.evaluate(priceAndVolume("AND"), Map.of("price", 150, "volume", 500));
            assertTrue(result.passed());
            assertEquals(LogicalOperator.AND, result.operator());
            assertEquals(2, result.passedCount());
        }

        @Test
        @DisplayName("AND fails when one rule fails")
        void andOneFails() {
            DecisionResult result = engine.evaluate(priceAndVolume("AND"), Map.of("price", 90, "volume", 500));
            assertFalse(result.passed());
            assertFalse(result.ruleResults().get(0).passed());
            assertTrue(result.ruleResults().get(1).passed());
            assertTrue(result.failureSummary().contains("price gt 100"));
        }

        @Test
        @DisplayName("OR passes when at least one rule passes")
        void orOnePasses() {
            assertTrue(engine.evaluate(priceAndVolume("OR"), Map.of("price", 90, "volume", 500)).passed());
        }

        @Test
        @DisplayName("OR fails when no rule passes")
        void orNonePass() {
            assertFalse(engine.evaluate(priceAndVolume("OR"), Map.of("price", 90, "volume", 5000)).passed());
        }

        @Test
        @DisplayName("combinator is case-insensitive and defaults to AND")
        void combinatorDefaults() {
            DecisionConfig lower = priceAndVolume("or");
            assertEquals(LogicalOperator.OR, engine.evaluate(lower, Map.of()).operator());

            DecisionConfig absent = new DecisionConfig(List.of(DecisionRule.of("a", "eq", 1)), null, null);
            assertEquals(LogicalOperator.AND, engine.evaluate(absent, Map.of("a", 1)).operator());
        }

        @Test
        @DisplayName("unknown combinator raises UnknownOperatorException")
        void unknownCombinator() {
            assertThrows(UnknownOperatorException.class,
                () -> engine.evaluate(priceAndVolume("XOR"), Map.of("price", 150)));
        }
    }

    // ── Operators ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("rule operators")
    class OperatorTests {

        private boolean eval(String field, String op, Object expected, Map<String, Object> data) {
            return engine.evaluate(DecisionConfig.of("AND", DecisionRule.of(field, op, expected)), data).passed();
        }

        @Test
        @DisplayName("between is inclusive on both bounds")
        void betweenBounds() {
            List<Integer> range = List.of(10, 20);
            assertTrue(eval("x", "between", range, Map.of("x", 10)));
            assertTrue(eval("x", "between", range, Map.of("x", 20)));
            assertTrue(eval("x", "between", range, Map.of("x", 15.5)));
            assertFalse(eval("x", "between", range, Map.of("x", 9.999)));
            assertFalse(eval("x", "between", range, Map.of("x", 20.001)));
        }

        @Test
        @DisplayName("malformed between range fails the rule with an error")
        void betweenMalformed() {
            DecisionResult result = engine.evaluate(
                DecisionConfig.of("AND", DecisionRule.of("x", "between", List.of(10))), Map.of("x", 10));
            assertFalse(result.passed());
            assertNotNull(result.ruleResults().get(0).error());
        }

        @Test
        @DisplayName("gte / lte include the boundary, gt / lt exclude it")
        void orderedComparisons() {
            Map<String, Object> data = Map.of("v", 5);
            assertTrue(eval("v", "gte", 5, data));
            assertTrue(eval("v", "lte", 5, data));
            assertFalse(eval("v", "gt", 5, data));
            assertFalse(eval("v", "lt", 5, data));
        }

        @Test
        @DisplayName("numeric strings and booleans are coerced for ordered comparisons")
        void numericCoercion() {
            assertTrue(eval("v", "gt", 100, Map.of("v", "150.5")));
            assertTrue(eval("flag", "gte", 1, Map.of("flag", true)));
            assertFalse(eval("v", "gt", 1, Map.of("v", "not-a-number")));
        }

        @Test
        @DisplayName("eq tolerates floating point noise between numbers")
        void eqNumeric() {
            assertTrue(eval("v", "eq", 0.3, Map.of("v", 0.1 + 0.2)));
            assertTrue(eval("v", "eq", 3, Map.of("v", 3.0)));
            assertFalse(eval("v", "eq", 3, Map.of("v", 3.1)));
        }

        @Test
        @DisplayName("eq / ne use exact equality for non-numbers")
        void eqNonNumeric() {
            assertTrue(eval("signal", "eq", "BUY", Map.of("signal", "BUY")));
            assertFalse(eval("signal", "eq", "BUY", Map.of("signal", "SELL")));
            assertTrue(eval("signal", "ne", "BUY", Map.of("signal", "SELL")));
            assertFalse(eval("v", "eq", "5", Map.of("v", 5)));
        }

        @Test
        @DisplayName("missing field fails every operator except ne against a non-null value")
        void missingField() {
            Map<String, Object> data = Map.of("other", 1);
            assertFalse(eval("missing", "gt", 0, data));
            assertFalse(eval("missing", "eq", 0, data));
            assertFalse(eval("missing", "between", List.of(0, 1), data));
            assertTrue(eval("missing", "ne", 0, data));
        }

        @Test
        @DisplayName("unknown rule operator raises UnknownOperatorException")
        void unknownRuleOperator() {
            assertThrows(UnknownOperatorException.class, () -> eval("v", "approx", 1, Map.of("v", 1)));
        }

        @Test
        @DisplayName("nested and indexed paths resolve")
        void nestedPaths() {
            Map<String, Object> data = Map.of("signal", Map.of("targets", List.of(Map.of("price", 42))));
            assertTrue(eval("signal.targets[0].price", "eq", 42, data));
        }
    }

    // ── validateConfig ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("validateConfig()")
    class ValidateConfigTests {

        @Test
        @DisplayName("valid config yields no errors")
        void validConfig() {
            assertTrue(engine.validateConfig(priceAndVolume("AND")).isEmpty());
        }

        @Test
        @DisplayName("empty rules are reported")
        void emptyRules() {
            List<String> errors = engine.validateConfig(new DecisionConfig(List.of(), "AND", null));
            assertEquals(1, errors.size());
            assertTrue(errors.get(0).contains("at least one rule"));
        }

        @Test
        @DisplayName("every problem is reported without throwing")
        void collectsAllErrors() {
            DecisionConfig config = new DecisionConfig(List.of(
                new DecisionRule("", "gt", 1, null),
                new DecisionRule("a", "approx", 1, null),
                new DecisionRule("b", "eq", null, null),
                new DecisionRule("c", "between", 5, null)
            ), "XOR", null);

            List<String> errors = engine.validateConfig(config);
            assertEquals(5, errors.size());
            assertTrue(errors.stream().anyMatch(e -> e.contains("Invalid operator: XOR")));
            assertTrue(errors.stream().anyMatch(e -> e.contains("Rule 0: field is required")));
            assertTrue(errors.stream().anyMatch(e -> e.contains("Rule 1: invalid operator 'approx'")));
            assertTrue(errors.stream().anyMatch(e -> e.contains("Rule 2: value is required")));
            assertTrue(errors.stream().anyMatch(e -> e.contains("Rule 3: 'between'")));
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("config helpers")
    class HelperTests {

        @Test
        @DisplayName("thresholdDecision builds a gt or lt rule")
        void threshold() {
            DecisionConfig above = DecisionEngine.thresholdDecision("confidence", 0.7, true, null);
            assertEquals("gt", above.rules().get(0).operator());
            assertEquals("confidence must be above 0.7", above.description());
            assertTrue(engine.evaluate(above, Map.of("confidence", 0.8)).passed());

            DecisionConfig below = DecisionEngine.thresholdDecision("rsi", 30, false, null);
            assertEquals("lt", below.rules().get(0).operator());
        }

        @Test
        @DisplayName("rangeDecision builds an inclusive between rule")
        void range() {
            DecisionConfig config = DecisionEngine.rangeDecision("rsi", 30, 70, null);
            assertTrue(engine.validateConfig(config).isEmpty());
            assertTrue(engine.evaluate(config, Map.of("rsi", 70)).passed());
            assertFalse(engine.evaluate(config, Map.of("rsi", 71)).passed());
        }

        @Test
        @DisplayName("simpleDecision wraps a single rule with AND")
        void simple() {
            DecisionConfig config = DecisionEngine.simpleDecision("signal", RuleOperator.EQ, "BUY", "buy only");
            assertEquals("AND", config.operator());
            assertEquals("eq", config.rules().get(0).operator());
            assertTrue(engine.evaluate(config, Map.of("signal", "BUY")).passed());
        }
    }
}
