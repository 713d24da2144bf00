package com.reporting.domain.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Helpers for navigating aggregation payloads.
 *
 * A payload is a record (object), a sequence (array) or a scalar. Its record
 * set is the array itself, the {@code records} array of an object carrying
 * one, the object itself as a single row, or the scalar as a single row.
 * Rule outputs are written under {@code aggregations}.
 */
public final class DataNodes {

    public static final String RECORDS_FIELD = "records";
    public static final String AGGREGATIONS_FIELD = "aggregations";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private DataNodes() {
    }

    public static JsonNodeFactory nodes() {
        return NODES;
    }

    public static List<JsonNode> records(JsonNode data) {
        List<JsonNode> rows = new ArrayList<>();
        if (data == null || data.isMissingNode() || data.isNull()) {
            return rows;
        }
        if (data.isArray()) {
            data.forEach(rows::add);
        } else if (data.isObject() && data.path(RECORDS_FIELD).isArray()) {
            data.path(RECORDS_FIELD).forEach(rows::add);
        } else {
            rows.add(data);
        }
        return rows;
    }

    /**
     * Resolves a dotted path such as {@code metrics.score}. A blank path
     * resolves to the node itself; an unknown path to a missing node.
     */
    public static JsonNode resolvePath(JsonNode node, String path) {
        if (node == null) {
            return MissingNode.getInstance();
        }
        if (path == null || path.isBlank()) {
            return node;
        }
        JsonNode current = node;
        for (String segment : path.split("\\.")) {
            if (current.isArray() && isIndex(segment)) {
                current = current.path(Integer.parseInt(segment));
            } else {
                current = current.path(segment);
            }
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    /**
     * Collects the values of {@code field} across the record set. Scalar rows
     * contribute themselves; array values are flattened.
     */
    public static List<JsonNode> fieldValues(JsonNode data, String field) {
        return fieldValues(records(data), field);
    }

    public static List<JsonNode> fieldValues(List<JsonNode> rows, String field) {
        List<JsonNode> values = new ArrayList<>();
        boolean wholeRow = isWholeRow(field);
        for (JsonNode row : rows) {
            if (wholeRow || !row.isContainerNode()) {
                values.add(row);
                continue;
            }
            JsonNode value = resolvePath(row, field);
            if (value.isMissingNode()) {
                continue;
            }
            if (value.isArray()) {
                value.forEach(values::add);
            } else {
                values.add(value);
            }
        }
        return values;
    }

    public static OptionalDouble numeric(JsonNode value) {
        if (value == null) {
            return OptionalDouble.empty();
        }
        if (value.isNumber()) {
            double number = value.asDouble();
            return Double.isFinite(number) ? OptionalDouble.of(number) : OptionalDouble.empty();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            // plain decimals only: no NaN, Infinity, hex floats or type suffixes
            if (!DECIMAL.matcher(text).matches()) {
                return OptionalDouble.empty();
            }
            double number = Double.parseDouble(text);
            return Double.isFinite(number) ? OptionalDouble.of(number) : OptionalDouble.empty();
        }
        return OptionalDouble.empty();
    }

    public static List<Double> numbers(List<JsonNode> values) {
        List<Double> numbers = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            numeric(value).ifPresent(numbers::add);
        }
        return numbers;
    }

    /**
     * Returns a new payload with {@code value} stored under
     * {@code aggregations.<key>}. The input is never modified.
     */
    public static JsonNode withAggregation(JsonNode data, String key, JsonNode value) {
        ObjectNode output;
        if (data.isObject()) {
            output = ((ObjectNode) data).deepCopy();
        } else {
            output = NODES.objectNode();
            ArrayNode rows = output.putArray(RECORDS_FIELD);
            if (data.isArray()) {
                data.forEach(row -> rows.add(row.deepCopy()));
            } else {
                rows.add(data.deepCopy());
            }
        }
        JsonNode existing = output.get(AGGREGATIONS_FIELD);
        ObjectNode aggregations = existing != null && existing.isObject()
                ? (ObjectNode) existing
                : output.putObject(AGGREGATIONS_FIELD);
        aggregations.set(key, value);
        return output;
    }

    /** Text used to bucket rows in group_by and pivot. */
    public static String groupKey(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) {
            return "null";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /** Output keys must stay addressable by dotted paths. */
    public static String keyFor(String field) {
        if (isWholeRow(field)) {
            return RECORDS_FIELD;
        }
        return field.trim().replace('.', '_');
    }

    static boolean isWholeRow(String field) {
        return field == null || field.isBlank() || "*".equals(field.trim());
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
