package app.tiered.entitlement.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Typed value of a plan feature: a limit, a flag, or structured configuration.
 */
public sealed interface FlexibleValue {

    ValueType type();

    /**
     * Numeric limit carried by this value, if any. Fractional limits are floored.
     */
    default OptionalLong asLimit() {
        return OptionalLong.empty();
    }

    static FlexibleValue ofNull() {
        return NullValue.INSTANCE;
    }

    record IntValue(long value) implements FlexibleValue {
        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }

        @Override
        public OptionalLong asLimit() {
            return OptionalLong.of(value);
        }
    }

    record FloatValue(double value) implements FlexibleValue {
        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public OptionalLong asLimit() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of((long) Math.floor(value));
        }
    }

    record BoolValue(boolean value) implements FlexibleValue {
        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }
    }

    record StringValue(String value) implements FlexibleValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }
    }

    record ListValue(List<FlexibleValue> items) implements FlexibleValue {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public ValueType type() {
            return ValueType.ARRAY;
        }
    }

    record ObjectValue(Map<String, FlexibleValue> fields) implements FlexibleValue {
        public ObjectValue {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public ValueType type() {
            return ValueType.OBJECT;
        }
    }

    final class NullValue implements FlexibleValue {

        static final NullValue INSTANCE = new NullValue();

        private NullValue() {
        }

        @Override
        public ValueType type() {
            return ValueType.NULL;
        }

        @Override
        public String toString() {
            return "NullValue";
        }
    }
}
