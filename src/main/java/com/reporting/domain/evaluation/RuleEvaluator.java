package com.reporting.domain.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reporting.domain.exception.RuleExecutionException;
import com.reporting.domain.model.AggregationOperation;
import com.reporting.domain.model.AggregationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Applies a single aggregation rule to a payload.
 *
 * Each operation is a pure transform: the input node is left untouched and a
 * new payload carrying the rule's output under {@code aggregations} is
 * returned. Failures are reported as {@link RuleExecutionException}.
 *
 * Numeric parameters are fail-soft: a missing or ill-typed value falls back to
 * its default. Structural parameters (pivot column, custom function) are
 * required.
 */
@Slf4j
@Component
public class RuleEvaluator {

    public static final double DEFAULT_PERCENTILE = 90.0;

    static final String PARAM_ALIAS = "alias";
    static final String PARAM_PERCENTILE = "percentile";
    static final String PARAM_AGGREGATE = "aggregate";
    static final String PARAM_TARGET = "target";
    static final String PARAM_COLUMN = "column";
    static final String PARAM_VALUE = "value";
    static final String PARAM_FUNCTION = "function";

    public JsonNode apply(JsonNode data, AggregationRule rule) {
        return apply(data, rule, Collections.emptyList());
    }

    /**
     * @param defaultGroupBy grouping fields from the request, used by group_by
     *                       and pivot rules that name no field of their own
     */
    public JsonNode apply(JsonNode data, AggregationRule rule, List<String> defaultGroupBy) {
        AggregationOperation operation = AggregationOperation.resolve(rule.getOperation())
                .orElseThrow(() -> new RuleExecutionException(
                        "unsupported aggregation operation: " + rule.getOperation()));

        if (data == null || data.isMissingNode() || data.isNull()) {
            throw new RuleExecutionException("no data to aggregate");
        }

        log.debug("Applying {} on field '{}'", operation.getWireName(), rule.getField());

        return switch (operation) {
            case COUNT, SUM, AVERAGE, MIN, MAX, MEDIAN, PERCENTILE -> applyStatistic(data, rule, operation);
            case GROUP_BY -> applyGroupBy(data, rule, defaultGroupBy);
            case PIVOT -> applyPivot(data, rule, defaultGroupBy);
            case CUSTOM -> applyCustom(data, rule);
        };
    }

    private JsonNode applyStatistic(JsonNode data, AggregationRule rule, AggregationOperation operation) {
        double percentile = percentileParameter(rule);
        List<JsonNode> values = DataNodes.fieldValues(data, rule.getField());
        JsonNode value = reduce(operation, values, percentile);

        String key = outputKey(rule, defaultStatisticKey(rule.getField(), operation, percentile));
        return DataNodes.withAggregation(data, key, value);
    }

    private JsonNode applyGroupBy(JsonNode data, AggregationRule rule, List<String> defaultGroupBy) {
        String groupField = groupingField(rule, defaultGroupBy, "group_by");
        AggregationOperation aggregate = nestedAggregate(rule, AggregationOperation.COUNT);
        String target = stringParameter(rule, PARAM_TARGET);
        if (target == null && aggregate != AggregationOperation.COUNT) {
            throw new RuleExecutionException("group_by with aggregate '" + aggregate.getWireName()
                    + "' requires parameter '" + PARAM_TARGET + "'");
        }
        double percentile = percentileParameter(rule);

        Map<String, List<JsonNode>> groups = groupRows(DataNodes.records(data), groupField);
        ObjectNode grouped = DataNodes.nodes().objectNode();
        groups.forEach((key, rows) ->
                grouped.set(key, reduce(aggregate, DataNodes.fieldValues(rows, target), percentile)));

        String key = outputKey(rule, DataNodes.keyFor(groupField) + "_groups");
        return DataNodes.withAggregation(data, key, grouped);
    }

    private JsonNode applyPivot(JsonNode data, AggregationRule rule, List<String> defaultGroupBy) {
        String rowField = groupingField(rule, defaultGroupBy, "pivot");
        String column = stringParameter(rule, PARAM_COLUMN);
        if (column == null) {
            throw new RuleExecutionException("pivot requires parameter '" + PARAM_COLUMN + "'");
        }
        AggregationOperation aggregate = nestedAggregate(rule, AggregationOperation.SUM);
        String valueField = stringParameter(rule, PARAM_VALUE);
        if (valueField == null && aggregate != AggregationOperation.COUNT) {
            throw new RuleExecutionException("pivot requires parameter '" + PARAM_VALUE + "'");
        }
        double percentile = percentileParameter(rule);

        ObjectNode table = DataNodes.nodes().objectNode();
        groupRows(DataNodes.records(data), rowField).forEach((rowKey, rows) -> {
            ObjectNode cells = table.putObject(rowKey);
            groupRows(rows, column).forEach((columnKey, cellRows) ->
                    cells.set(columnKey, reduce(aggregate, DataNodes.fieldValues(cellRows, valueField), percentile)));
        });

        String key = outputKey(rule, DataNodes.keyFor(rowField) + "_by_" + DataNodes.keyFor(column));
        return DataNodes.withAggregation(data, key, table);
    }

    private JsonNode applyCustom(JsonNode data, AggregationRule rule) {
        String function = stringParameter(rule, PARAM_FUNCTION);
        if (function == null) {
            throw new RuleExecutionException("custom operation requires parameter '" + PARAM_FUNCTION + "'");
        }
        String normalized = function.trim().toLowerCase(Locale.ROOT);
        List<JsonNode> values = DataNodes.fieldValues(data, rule.getField());
        List<Double> numbers = DataNodes.numbers(values);

        JsonNode value = switch (normalized) {
            case "distinct_count" -> DataNodes.nodes().numberNode(distinct(values).size());
            case "range" -> {
                OptionalDouble min = Statistics.min(numbers);
                OptionalDouble max = Statistics.max(numbers);
                yield min.isPresent()
                        ? DataNodes.nodes().numberNode(max.getAsDouble() - min.getAsDouble())
                        : NullNode.getInstance();
            }
            case "variance" -> toNode(Statistics.variance(numbers));
            case "stddev" -> toNode(Statistics.standardDeviation(numbers));
            case "mode" -> mode(values);
            default -> throw new RuleExecutionException("unsupported custom function: " + function);
        };

        String key = outputKey(rule, DataNodes.keyFor(rule.getField()) + "_" + normalized);
        return DataNodes.withAggregation(data, key, value);
    }

    /**
     * Reduces values with a statistical operation. Non-numeric values are
     * ignored by everything except count.
     */
    JsonNode reduce(AggregationOperation operation, List<JsonNode> values, double percentile) {
        List<Double> numbers = DataNodes.numbers(values);
        return switch (operation) {
            case COUNT -> DataNodes.nodes().numberNode(
                    values.stream().filter(v -> !v.isNull() && !v.isMissingNode()).count());
            case SUM -> DataNodes.nodes().numberNode(Statistics.sum(numbers));
            case AVERAGE -> toNode(Statistics.average(numbers));
            case MIN -> toNode(Statistics.min(numbers));
            case MAX -> toNode(Statistics.max(numbers));
            case MEDIAN -> toNode(Statistics.median(numbers));
            case PERCENTILE -> toNode(Statistics.percentile(numbers, percentile));
            case GROUP_BY, PIVOT, CUSTOM -> throw new RuleExecutionException(
                    operation.getWireName() + " cannot be used as a nested aggregate");
        };
    }

    double percentileParameter(AggregationRule rule) {
        Object raw = rule.getParameters().get(PARAM_PERCENTILE);
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric percentile '{}', using {}", text, DEFAULT_PERCENTILE);
                return DEFAULT_PERCENTILE;
            }
        } else {
            return DEFAULT_PERCENTILE;
        }
        if (Double.isNaN(value) || value <= 0 || value > 100) {
            return DEFAULT_PERCENTILE;
        }
        return value;
    }

    private AggregationOperation nestedAggregate(AggregationRule rule, AggregationOperation fallback) {
        String name = stringParameter(rule, PARAM_AGGREGATE);
        if (name == null) {
            return fallback;
        }
        AggregationOperation operation = AggregationOperation.resolve(name)
                .orElseThrow(() -> new RuleExecutionException("unsupported nested aggregate: " + name));
        if (!operation.isStatistical()) {
            throw new RuleExecutionException(operation.getWireName() + " cannot be used as a nested aggregate");
        }
        return operation;
    }

    private String groupingField(AggregationRule rule, List<String> defaultGroupBy, String operation) {
        if (rule.getField() != null && !rule.getField().isBlank()) {
            return rule.getField().trim();
        }
        if (defaultGroupBy != null) {
            for (String candidate : defaultGroupBy) {
                if (candidate != null && !candidate.isBlank()) {
                    return candidate.trim();
                }
            }
        }
        throw new RuleExecutionException(operation + " requires a grouping field");
    }

    private Map<String, List<JsonNode>> groupRows(List<JsonNode> rows, String field) {
        Map<String, List<JsonNode>> groups = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            String key = DataNodes.groupKey(DataNodes.resolvePath(row, field));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        return groups;
    }

    private String defaultStatisticKey(String field, AggregationOperation operation, double percentile) {
        String base = DataNodes.keyFor(field);
        if (operation == AggregationOperation.PERCENTILE) {
            String rank = percentile == Math.rint(percentile)
                    ? String.valueOf((long) percentile)
                    : String.valueOf(percentile).replace('.', '_');
            return base + "_p" + rank;
        }
        return base + "_" + operation.getWireName();
    }

    private String outputKey(AggregationRule rule, String fallback) {
        String alias = stringParameter(rule, PARAM_ALIAS);
        return alias != null ? alias : fallback;
    }

    private static String stringParameter(AggregationRule rule, String name) {
        Object raw = rule.getParameters().get(name);
        if (raw == null) {
            return null;
        }
        String text = raw.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static Set<String> distinct(List<JsonNode> values) {
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode value : values) {
            if (!value.isNull()) {
                seen.add(DataNodes.groupKey(value));
            }
        }
        return seen;
    }

    private static JsonNode mode(List<JsonNode> values) {
        Map<String, Integer> counts = new HashMap<>();
        JsonNode best = NullNode.getInstance();
        int bestCount = 0;
        for (JsonNode value : values) {
            if (value.isNull()) {
                continue;
            }
            int count = counts.merge(DataNodes.groupKey(value), 1, Integer::sum);
            if (count > bestCount) {
                bestCount = count;
                best = value;
            }
        }
        return best.deepCopy();
    }

    private static JsonNode toNode(OptionalDouble value) {
        return value.isPresent() ? DataNodes.nodes().numberNode(value.getAsDouble()) : NullNode.getInstance();
    }
}
