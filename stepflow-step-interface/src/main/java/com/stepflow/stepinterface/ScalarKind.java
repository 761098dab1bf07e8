package com.stepflow.stepinterface;

import java.util.Optional;

/**
 * JSON-native scalar types an input or output can be declared with.
 */
public enum ScalarKind {
    STRING(String.class, null, 0),
    BOOLEAN(Boolean.class, boolean.class, 0),
    CHARACTER(Character.class, char.class, 0),
    BYTE(Byte.class, byte.class, 1),
    SHORT(Short.class, short.class, 2),
    INTEGER(Integer.class, int.class, 3),
    LONG(Long.class, long.class, 4),
    FLOAT(Float.class, float.class, 5),
    DOUBLE(Double.class, double.class, 6);

    private final Class<?> boxedType;
    private final Class<?> primitiveType;
    private final int numericRank;

    ScalarKind(Class<?> boxedType, Class<?> primitiveType, int numericRank) {
        this.boxedType = boxedType;
        this.primitiveType = primitiveType;
        this.numericRank = numericRank;
    }

    public Class<?> boxedType() {
        return boxedType;
    }

    public boolean isIntegral() {
        return this == BYTE || this == SHORT || this == INTEGER || this == LONG;
    }

    public boolean isFloating() {
        return this == FLOAT || this == DOUBLE;
    }

    /** Whether a value declared as {@code source} can be used where this kind is declared. */
    public boolean accepts(ScalarKind source) {
        if (source == this) return true;
        if (numericRank == 0 || source.numericRank == 0) return false;
        return source.numericRank < numericRank;
    }

    /** Scalar kind for a primitive, boxed primitive or {@code String}; empty for every other class. */
    public static Optional<ScalarKind> forClass(Class<?> type) {
        if (type == null) return Optional.empty();
        for (ScalarKind kind : values()) {
            if (kind.boxedType == type || kind.primitiveType == type) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
