package app.tiered.entitlement.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A feature value that is either global or varies per locale.
 * Translatable entries keep their insertion order.
 */
public sealed interface LocalizableValue {

    static LocalizableValue single(FlexibleValue value) {
        return new Single(value);
    }

    static LocalizableValue translatable(Map<String, FlexibleValue> entries) {
        return new Translatable(entries);
    }

    record Single(FlexibleValue value) implements LocalizableValue {
        public Single {
            Objects.requireNonNull(value, "value");
        }
    }

    record Translatable(Map<String, FlexibleValue> entries) implements LocalizableValue {
        public Translatable {
            if (entries == null || entries.isEmpty()) {
                throw new IllegalArgumentException("Translatable value requires at least one locale");
            }
            for (String locale : entries.keySet()) {
                if (!FlexibleValueCodec.isLocaleCode(locale)) {
                    throw new IllegalArgumentException("Invalid locale code: " + locale);
                }
            }
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }
}
