package app.tiered.entitlement.value;

import java.util.Arrays;
import java.util.Optional;

public enum ValueType {
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean"),
    STRING("string"),
    ARRAY("array"),
    OBJECT("object"),
    NULL("null");

    private final String wireName;

    ValueType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ValueType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}
