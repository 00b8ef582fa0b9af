package com.oclparser.view;

import java.util.List;
import java.util.Objects;

/**
 * A literal attribute value: a String, Number or Boolean.
 */
public record Scalar(Object value) implements ViewValue {

    public Scalar {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
            throw new IllegalArgumentException("Unsupported scalar type: " + value.getClass().getName());
        }
    }

    public static Scalar of(Object value) {
        return new Scalar(value);
    }

    @Override
    public List<String> keys() {
        return List.of();
    }

    @Override
    public Object toInterchangeTree() {
        return value;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
