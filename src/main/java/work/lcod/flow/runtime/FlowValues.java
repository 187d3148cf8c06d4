package work.lcod.flow.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Display, truthiness, equality and JSON conversion for {@link FlowValue}s.
 */
public final class FlowValues {
    private static final ObjectMapper JSON = new ObjectMapper();

    private FlowValues() {}

    public static String display(FlowValue value) {
        if (value instanceof FlowValue.Text text) {
            return text.value();
        }
        if (value instanceof FlowValue.Num number) {
            return formatNumber(number.value());
        }
        if (value instanceof FlowValue.Bool bool) {
            return Boolean.toString(bool.value());
        }
        if (value instanceof FlowValue.ListValue list) {
            return list.items().stream().map(FlowValues::display).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof FlowValue.RecordValue record) {
            return record.fields().entrySet().stream()
                .map(entry -> entry.getKey() + ": " + display(entry.getValue()))
                .collect(Collectors.joining(", ", "{ ", " }"));
        }
        return "(empty)";
    }

    public static boolean isTruthy(FlowValue value) {
        if (value instanceof FlowValue.Text text) {
            return !text.value().isEmpty();
        }
        if (value instanceof FlowValue.Num number) {
            return number.value() != 0;
        }
        if (value instanceof FlowValue.Bool bool) {
            return bool.value();
        }
        if (value instanceof FlowValue.ListValue list) {
            return !list.items().isEmpty();
        }
        if (value instanceof FlowValue.RecordValue record) {
            return !record.fields().isEmpty();
        }
        return false;
    }

    /** Structural equality; numbers compare by value so {@code 0} equals {@code -0}. */
    public static boolean equal(FlowValue left, FlowValue right) {
        if (left instanceof FlowValue.Num a && right instanceof FlowValue.Num b) {
            return a.value() == b.value();
        }
        if (left instanceof FlowValue.ListValue a && right instanceof FlowValue.ListValue b) {
            if (a.items().size() != b.items().size()) {
                return false;
            }
            for (int i = 0; i < a.items().size(); i++) {
                if (!equal(a.items().get(i), b.items().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof FlowValue.RecordValue a && right instanceof FlowValue.RecordValue b) {
            if (a.fields().size() != b.fields().size()) {
                return false;
            }
            for (var entry : a.fields().entrySet()) {
                FlowValue other = b.fields().get(entry.getKey());
                if (other == null || !equal(entry.getValue(), other)) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Converts plain Java data (maps, lists, numbers, strings, booleans, null) or a Jackson tree
     * into a value. Anything else becomes its string form.
     */
    public static FlowValue fromJava(Object data) {
        if (data == null) {
            return FlowValue.EMPTY;
        }
        if (data instanceof FlowValue value) {
            return value;
        }
        if (data instanceof JsonNode node) {
            return fromJava(JSON.convertValue(node, Object.class));
        }
        if (data instanceof String text) {
            return FlowValue.text(text);
        }
        if (data instanceof Number number) {
            return FlowValue.number(number.doubleValue());
        }
        if (data instanceof Boolean bool) {
            return FlowValue.bool(bool);
        }
        if (data instanceof Map<?, ?> map) {
            var fields = new LinkedHashMap<String, FlowValue>();
            map.forEach((key, value) -> fields.put(String.valueOf(key), fromJava(value)));
            return FlowValue.record(fields);
        }
        if (data instanceof Iterable<?> iterable) {
            var items = new ArrayList<FlowValue>();
            iterable.forEach(item -> items.add(fromJava(item)));
            return FlowValue.list(items);
        }
        return FlowValue.text(String.valueOf(data));
    }

    /** Plain Java form suitable for Jackson; whole numbers become {@code Long}. */
    public static Object toJava(FlowValue value) {
        if (value instanceof FlowValue.Text text) {
            return text.value();
        }
        if (value instanceof FlowValue.Num number) {
            double raw = number.value();
            if (raw == Math.rint(raw) && Math.abs(raw) < 1e15) {
                return (long) raw;
            }
            return raw;
        }
        if (value instanceof FlowValue.Bool bool) {
            return bool.value();
        }
        if (value instanceof FlowValue.ListValue list) {
            List<Object> items = new ArrayList<>();
            list.items().forEach(item -> items.add(toJava(item)));
            return items;
        }
        if (value instanceof FlowValue.RecordValue record) {
            Map<String, Object> fields = new LinkedHashMap<>();
            record.fields().forEach((key, field) -> fields.put(key, toJava(field)));
            return fields;
        }
        return null;
    }

    public static Map<String, Object> toJava(Map<String, FlowValue> values) {
        Map<String, Object> converted = new LinkedHashMap<>();
        values.forEach((key, value) -> converted.put(key, toJava(value)));
        return converted;
    }

    public static FlowValue parseJson(String json) {
        try {
            return fromJava(JSON.readValue(json, Object.class));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String toJson(FlowValue value) {
        try {
            return JSON.writeValueAsString(toJava(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize value: " + ex.getMessage(), ex);
        }
    }
}
