package work.lcod.flow.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A runtime value. Exactly six shapes exist; the language has no null and uses {@link #EMPTY}
 * for absence.
 */
public sealed interface FlowValue {
    FlowValue EMPTY = Empty.INSTANCE;

    /** Name of the shape as shown in error messages. */
    String typeName();

    static FlowValue text(String value) {
        return new Text(value);
    }

    static FlowValue number(double value) {
        return new Num(value);
    }

    static FlowValue bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static FlowValue list(List<FlowValue> items) {
        return new ListValue(items);
    }

    static FlowValue record(Map<String, FlowValue> fields) {
        return new RecordValue(fields);
    }

    record Text(String value) implements FlowValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName() {
            return "text";
        }
    }

    record Num(double value) implements FlowValue {
        @Override
        public String typeName() {
            return "number";
        }
    }

    record Bool(boolean value) implements FlowValue {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record ListValue(List<FlowValue> items) implements FlowValue {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public String typeName() {
            return "list";
        }
    }

    /** Insertion-ordered fields. */
    record RecordValue(Map<String, FlowValue> fields) implements FlowValue {
        public RecordValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public String typeName() {
            return "record";
        }
    }

    enum Empty implements FlowValue {
        INSTANCE;

        @Override
        public String typeName() {
            return "empty";
        }
    }
}
