package com.reporting.domain.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.reporting.domain.evaluation.DataNodes;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Condition node implementations produced by {@link ConditionParser}.
 */
final class Conditions {

    /** Resolves to the size of the record set unless the data defines it. */
    static final String RECORD_COUNT = "record_count";

    private Conditions() {
    }

    enum Comparison {
        EQ, NE, GT, GTE, LT, LTE
    }

    record Constant(boolean value) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            return value;
        }
    }

    record And(List<Condition> conditions) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            return conditions.stream().allMatch(c -> c.test(data));
        }
    }

    record Or(List<Condition> conditions) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            return conditions.stream().anyMatch(c -> c.test(data));
        }
    }

    record Not(Condition inner) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            return !inner.test(data);
        }
    }

    record Compare(String path, Comparison comparison, Object literal) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            JsonNode value = resolve(data, path);
            if (value.isMissingNode()) {
                return false;
            }
            return switch (comparison) {
                case EQ -> matches(value, literal);
                case NE -> !matches(value, literal);
                case GT -> compare(value, literal) > 0;
                case GTE -> compare(value, literal) >= 0;
                case LT -> compare(value, literal) < 0;
                case LTE -> compare(value, literal) <= 0;
            };
        }

        // NaN when either side is not numeric, which makes every ordering false
        private static double compare(JsonNode value, Object literal) {
            OptionalDouble left = DataNodes.numeric(value);
            if (left.isEmpty() || !(literal instanceof Number number)) {
                return Double.NaN;
            }
            return Double.compare(left.getAsDouble(), number.doubleValue());
        }
    }

    record In(String path, List<Object> literals, boolean negated) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            JsonNode value = resolve(data, path);
            if (value.isMissingNode()) {
                return false;
            }
            boolean found = literals.stream().anyMatch(literal -> matches(value, literal));
            return negated != found;
        }
    }

    record Contains(String path, Object literal) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            JsonNode value = resolve(data, path);
            if (value.isArray()) {
                for (JsonNode element : value) {
                    if (matches(element, literal)) {
                        return true;
                    }
                }
                return false;
            }
            if (value.isTextual() && literal != null) {
                return value.asText().contains(literal.toString());
            }
            return false;
        }
    }

    record Exists(String path) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            JsonNode value = resolve(data, path);
            return !value.isMissingNode() && !value.isNull();
        }
    }

    record IsNull(String path) implements Condition {
        @Override
        public boolean test(JsonNode data) {
            JsonNode value = resolve(data, path);
            return value.isMissingNode() || value.isNull();
        }
    }

    static JsonNode resolve(JsonNode data, String path) {
        JsonNode value = DataNodes.resolvePath(data, path);
        if (value.isMissingNode() && RECORD_COUNT.equals(path)) {
            return DataNodes.nodes().numberNode(DataNodes.records(data).size());
        }
        return value;
    }

    static boolean matches(JsonNode value, Object literal) {
        if (literal == null) {
            return value.isNull();
        }
        if (value.isNull()) {
            return false;
        }
        if (literal instanceof Boolean flag) {
            return value.isBoolean() ? value.asBoolean() == flag : value.asText().equalsIgnoreCase(flag.toString());
        }
        OptionalDouble left = DataNodes.numeric(value);
        if (literal instanceof Number number) {
            return left.isPresent() && left.getAsDouble() == number.doubleValue();
        }
        if (value.isNumber() && left.isPresent()) {
            try {
                return left.getAsDouble() == Double.parseDouble(literal.toString());
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return value.asText().equals(literal.toString());
    }
}
