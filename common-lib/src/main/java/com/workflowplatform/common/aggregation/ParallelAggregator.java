package com.workflowplatform.common.aggregation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines the settled results of a parallel stage group into a single output map.
 *
 * <p>Only successful results contribute data. Every aggregate carries a {@value #METADATA_KEY}
 * entry with counts, the strategy used and per-source timing. When no member succeeded the
 * aggregate holds nothing but metadata with {@code allFailed=true} and the per-agent errors.
 *
 * <p>Never throws for well-formed input; pure apart from logging.
 */
public class ParallelAggregator {

    private static final Logger log = LoggerFactory.getLogger(ParallelAggregator.class);

    public static final String METADATA_KEY = "metadata";
    public static final String BY_AGENT_KEY = "byAgent";

    public Map<String, Object> aggregate(List<StageRunResult> results, AggregationStrategy strategy) {
        return aggregate(results, strategy, null);
    }

    /**
     * @param wallClockMs elapsed time of the whole group; when non-null the metadata also reports
     *                    the bottleneck member and parallel efficiency
     */
    public Map<String, Object> aggregate(List<StageRunResult> results, AggregationStrategy strategy,
                                         Long wallClockMs) {
        AggregationStrategy effective = strategy == null ? AggregationStrategy.MERGE : strategy;
        List<StageRunResult> successful = results.stream().filter(StageRunResult::success).toList();

        Map<String, Object> aggregate;
        if (successful.isEmpty()) {
            aggregate = new LinkedHashMap<>();
        } else {
            aggregate = switch (effective) {
                case FIRST    -> new LinkedHashMap<>(outputOf(successful.get(0)));
                case LAST     -> new LinkedHashMap<>(outputOf(successful.get(successful.size() - 1)));
                case AVERAGE  -> average(successful);
                case WEIGHTED -> weighted(successful);
                case MERGE    -> merge(successful);
            };
        }

        Map<String, Object> metadata = metadata(results, successful, effective, wallClockMs);
        if (effective == AggregationStrategy.FIRST && !successful.isEmpty()) {
            metadata.put("selectedAgent", successful.get(0).agentId());
        } else if (effective == AggregationStrategy.LAST && !successful.isEmpty()) {
            metadata.put("selectedAgent", successful.get(successful.size() - 1).agentId());
        }
        aggregate.put(METADATA_KEY, metadata);

        log.debug("Parallel results aggregated. strategy={} total={} successful={}",
            effective.value(), results.size(), successful.size());
        return aggregate;
    }

    // ── Strategies ──────────────────────────────────────────────────────────

    private Map<String, Object> average(List<StageRunResult> successful) {
        Map<String, List<Double>> values = numericFields(successful);
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((field, list) -> {
            double sum = 0.0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : list) {
                sum += v;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            out.put(field, sum / list.size());
            out.put(field + "_min", min);
            out.put(field + "_max", max);
            out.put(field + "_count", list.size());
        });
        return out;
    }

    /**
     * {@code weight = (maxDuration - duration + 1) / maxDuration}, normalised over the members
     * that carry the field. Equal weights when every member took zero milliseconds.
     */
    private Map<String, Object> weighted(List<StageRunResult> successful) {
        long maxDuration = successful.stream().mapToLong(StageRunResult::durationMs).max().orElse(0L);
        Map<String, Double> weights = new LinkedHashMap<>();
        for (StageRunResult r : successful) {
            double weight = maxDuration <= 0
                ? 1.0
                : (double) (maxDuration - r.durationMs() + 1) / maxDuration;
            weights.put(r.agentId(), weight);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        for (String field : numericFields(successful).keySet()) {
            double weightSum = 0.0;
            double weightedSum = 0.0;
            for (StageRunResult r : successful) {
                Object value = outputOf(r).get(field);
                if (value instanceof Number n) {
                    double w = weights.get(r.agentId());
                    weightSum += w;
                    weightedSum += w * n.doubleValue();
                }
            }
            out.put(field, weightSum == 0.0 ? 0.0 : weightedSum / weightSum);
        }

        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Object> normalised = new LinkedHashMap<>();
        weights.forEach((agentId, w) -> normalised.put(agentId, total == 0.0 ? 0.0 : w / total));
        out.put("weights", normalised);
        return out;
    }

    private Map<String, Object> merge(List<StageRunResult> successful) {
        Map<String, Object> byAgent = new LinkedHashMap<>();
        Map<String, List<Object>> valuesByKey = new LinkedHashMap<>();
        for (StageRunResult r : successful) {
            Map<String, Object> output = outputOf(r);
            byAgent.put(r.agentId(), output);
            output.forEach((key, value) -> valuesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(value));
        }

        Map<String, Object> out = new LinkedHashMap<>();
        valuesByKey.forEach((key, values) -> {
            if (values.size() == 1) {
                out.put(key, values.get(0));
            } else if (values.stream().allMatch(v -> v instanceof Number)) {
                out.put(key, List.copyOf(values));
            } else if (values.stream().allMatch(v -> Objects.equals(v, values.get(0)))) {
                out.put(key, values.get(0));
            }
            // conflicting non-numeric values stay reachable under byAgent only
        });
        out.put(BY_AGENT_KEY, byAgent);
        return out;
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private static Map<String, Object> outputOf(StageRunResult r) {
        return r.output() == null ? Map.of() : r.output();
    }

    private static Map<String, List<Double>> numericFields(List<StageRunResult> successful) {
        Map<String, List<Double>> values = new LinkedHashMap<>();
        for (StageRunResult r : successful) {
            outputOf(r).forEach((key, value) -> {
                if (value instanceof Number n) {
                    values.computeIfAbsent(key, k -> new ArrayList<>()).add(n.doubleValue());
                }
            });
        }
        return values;
    }

    private static Map<String, Object> metadata(List<StageRunResult> results, List<StageRunResult> successful,
                                                AggregationStrategy strategy, Long wallClockMs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("totalResults", results.size());
        metadata.put("successfulResults", successful.size());
        metadata.put("failedResults", results.size() - successful.size());
        metadata.put("strategy", strategy.value());

        List<Map<String, Object>> sources = new ArrayList<>();
        for (StageRunResult r : results) {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("agentId", r.agentId());
            source.put("stageType", r.stageType());
            source.put("durationMs", r.durationMs());
            source.put("success", r.success());
            sources.add(source);
        }
        metadata.put("sources", sources);

        if (successful.isEmpty()) {
            metadata.put("allFailed", true);
            Map<String, Object> errors = new LinkedHashMap<>();
            results.forEach(r -> errors.put(r.agentId(), r.error()));
            metadata.put("errors", errors);
        }

        if (wallClockMs != null && !results.isEmpty()) {
            StageRunResult slowest = results.get(0);
            long sequential = 0L;
            for (StageRunResult r : results) {
                sequential += r.durationMs();
                if (r.durationMs() > slowest.durationMs()) {
                    slowest = r;
                }
            }
            Map<String, Object> bottleneck = new LinkedHashMap<>();
            bottleneck.put("agentId", slowest.agentId());
            bottleneck.put("durationMs", slowest.durationMs());
            metadata.put("bottleneck", bottleneck);
            metadata.put("sequentialDurationMs", sequential);
            metadata.put("wallClockDurationMs", wallClockMs);
            metadata.put("parallelEfficiency",
                sequential > 0 ? (double) (sequential - wallClockMs) / sequential * 100.0 : 0.0);
        }
        return metadata;
    }
}
