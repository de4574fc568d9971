package com.draupnir.policy.model.document;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * String, number or boolean leaf.
 */
public final class ScalarNode extends DocumentNode {

    private final Object value;

    private ScalarNode(Object value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static ScalarNode of(String value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(Number value) {
        return new ScalarNode(value);
    }

    public static ScalarNode of(boolean value) {
        return new ScalarNode(value);
    }

    @Override
    public Type getType() {
        return Type.SCALAR;
    }

    @Override
    public Optional<ScalarNode> asScalar() {
        return Optional.of(this);
    }

    public Object getValue() {
        return value;
    }

    public boolean isText() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    public String asText() {
        return String.valueOf(value);
    }

    @Override
    public boolean isTruthy() {
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() != 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0.0;
        }
        return true;
    }

    @Override
    public Object toPlainObject() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScalarNode && value.equals(((ScalarNode) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return asText();
    }
}
