package com.workflowplatform.common.decision;

import com.workflowplatform.common.exception.UnknownOperatorException;
import com.workflowplatform.common.model.DecisionConfig;
import com.workflowplatform.common.model.DecisionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates rule-based decisions against stage output.
 *
 * <h3>Rule semantics</h3>
 * <ul>
 *   <li>The field path is resolved with {@link FieldPathResolver}. A missing value fails every
 *       operator except {@code ne}, which passes when the expected value is non-null.</li>
 *   <li>{@code gt/gte/lt/lte} compare after {@link NumberCoercion}; non-numeric operands fail.</li>
 *   <li>{@code eq/ne} use a tolerance of {@code ulp(1.0)} when both operands are numbers,
 *       exact equality otherwise.</li>
 *   <li>{@code between} takes {@code [min, max]} inclusive. A malformed range fails that rule
 *       and records the error on its result.</li>
 * </ul>
 *
 * <p>An unknown rule or combinator operator raises {@link UnknownOperatorException};
 * callers are expected to run {@link #validateConfig} first.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    static final double EPSILON = Math.ulp(1.0);

    public DecisionResult evaluate(DecisionConfig config, Object data) {
        long start = System.nanoTime();
        LogicalOperator combinator = LogicalOperator.fromValue(config.operator());

        List<RuleEvaluationResult> ruleResults = new ArrayList<>(config.rules().size());
        for (DecisionRule rule : config.rules()) {
            ruleResults.add(evaluateRule(rule, data));
        }

        boolean passed = combinator == LogicalOperator.AND
            ? ruleResults.stream().allMatch(RuleEvaluationResult::passed)
            : ruleResults.stream().anyMatch(RuleEvaluationResult::passed);

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        DecisionResult result = new DecisionResult(passed, combinator, List.copyOf(ruleResults),
            Instant.now(), durationMs);

        log.info("Decision evaluated. passed={} operator={} rulesPassed={}/{} durationMs={}",
            passed, combinator, result.passedCount(), ruleResults.size(), durationMs);
        return result;
    }

    private RuleEvaluationResult evaluateRule(DecisionRule rule, Object data) {
        RuleOperator operator = RuleOperator.fromValue(rule.operator());
        Object actual = FieldPathResolver.resolve(data, rule.field());
        try {
            boolean passed = compare(actual, operator, rule.value());
            return new RuleEvaluationResult(rule, passed, actual, rule.value(), null);
        } catch (IllegalArgumentException e) {
            log.warn("Rule could not be evaluated. field={} operator={} reason={}",
                rule.field(), rule.operator(), e.getMessage());
            return new RuleEvaluationResult(rule, false, actual, rule.value(), e.getMessage());
        }
    }

    private boolean compare(Object actual, RuleOperator operator, Object expected) {
        if (actual == null) {
            return operator == RuleOperator.NE && expected != null;
        }
        return switch (operator) {
            case GT  -> NumberCoercion.toDouble(actual) >  NumberCoercion.toDouble(expected);
            case GTE -> NumberCoercion.toDouble(actual) >= NumberCoercion.toDouble(expected);
            case LT  -> NumberCoercion.toDouble(actual) <  NumberCoercion.toDouble(expected);
            case LTE -> NumberCoercion.toDouble(actual) <= NumberCoercion.toDouble(expected);
            case EQ  -> valuesEqual(actual, expected);
            case NE  -> !valuesEqual(actual, expected);
            case BETWEEN -> {
                List<?> range = asRange(expected);
                double value = NumberCoercion.toDouble(actual);
                yield value >= NumberCoercion.toDouble(range.get(0))
                    && value <= NumberCoercion.toDouble(range.get(1));
            }
        };
    }

    private static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return Math.abs(a.doubleValue() - e.doubleValue()) < EPSILON;
        }
        return actual.equals(expected);
    }

    private static List<?> asRange(Object value) {
        if (value instanceof List<?> list && list.size() == 2) {
            return list;
        }
        if (value instanceof Object[] array && array.length == 2) {
            return List.of(array);
        }
        if (value instanceof double[] array && array.length == 2) {
            return List.of(array[0], array[1]);
        }
        throw new IllegalArgumentException("Between operator requires array of [min, max]");
    }

    /**
     * Checks a decision config without evaluating it. Never throws.
     *
     * @return human-readable problems; empty when the config is usable
     */
    public List<String> validateConfig(DecisionConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("Decision config is required");
            return errors;
        }
        if (config.rules().isEmpty()) {
            errors.add("Decision config must have at least one rule");
        }
        if (config.operator() != null) {
            try {
                LogicalOperator.fromValue(config.operator());
            } catch (UnknownOperatorException e) {
                errors.add("Invalid operator: " + config.operator() + ". Must be 'AND' or 'OR'");
            }
        }
        for (int i = 0; i < config.rules().size(); i++) {
            DecisionRule rule = config.rules().get(i);
            if (rule.field() == null || rule.field().isBlank()) {
                errors.add("Rule " + i + ": field is required");
            }
            if (!RuleOperator.isKnown(rule.operator())) {
                errors.add("Rule " + i + ": invalid operator '" + rule.operator() + "'");
            }
            if (rule.value() == null) {
                errors.add("Rule " + i + ": value is required");
            }
            if (rule.operator() != null && "between".equalsIgnoreCase(rule.operator().trim())) {
                try {
                    asRange(rule.value());
                } catch (IllegalArgumentException e) {
                    errors.add("Rule " + i + ": 'between' operator requires array of [min, max]");
                }
            }
        }
        return errors;
    }

    // ── Config helpers ──────────────────────────────────────────────────────

    public static DecisionConfig simpleDecision(String field, RuleOperator operator, Object value,
                                                String description) {
        return new DecisionConfig(
            List.of(new DecisionRule(field, operator.value(), value, description)), "AND", description);
    }

    public static DecisionConfig rangeDecision(String field, double min, double max, String description) {
        String text = description != null ? description : field + " must be between " + min + " and " + max;
        return new DecisionConfig(
            List.of(new DecisionRule(field, RuleOperator.BETWEEN.value(), List.of(min, max), description)),
            "AND", text);
    }

    public static DecisionConfig thresholdDecision(String field, double threshold, boolean above,
                                                   String description) {
        String text = description != null
            ? description
            : field + " must be " + (above ? "above " : "below ") + threshold;
        RuleOperator operator = above ? RuleOperator.GT : RuleOperator.LT;
        return new DecisionConfig(
            List.of(new DecisionRule(field, operator.value(), threshold, description)), "AND", text);
    }
}
