package org.finos.legend.ql.store;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Semantic column types understood by the query builder.
 *
 * Numeric types widen in declaration order: INTEGER < LONG < DOUBLE.
 */
public enum ColumnType {
    INTEGER(Family.NUMERIC),
    LONG(Family.NUMERIC),
    DOUBLE(Family.NUMERIC),
    STRING(Family.STRING),
    BOOLEAN(Family.BOOLEAN),
    DATE(Family.TEMPORAL),
    DATETIME(Family.TEMPORAL);

    /**
     * Groups of types whose values can be compared with each other.
     */
    public enum Family {
        NUMERIC,
        STRING,
        BOOLEAN,
        TEMPORAL
    }

    private final Family family;

    ColumnType(Family family) {
        this.family = family;
    }

    public boolean isNumeric() {
        return family == Family.NUMERIC;
    }

    public boolean isIntegral() {
        return this == INTEGER || this == LONG;
    }

    /**
     * @return true if values of both types can be compared with {@code <, >, ==}
     */
    public boolean isComparableWith(ColumnType other) {
        return family == other.family;
    }

    /**
     * Returns the wider of two numeric types.
     *
     * @throws IllegalArgumentException if either type is not numeric
     */
    public ColumnType widen(ColumnType other) {
        if (!isNumeric() || !other.isNumeric()) {
            throw new IllegalArgumentException("Cannot widen " + this + " and " + other);
        }
        return ordinal() >= other.ordinal() ? this : other;
    }

    /**
     * Maps a Java class to its column type.
     *
     * @throws IllegalArgumentException for classes with no column mapping
     */
    public static ColumnType of(Class<?> javaType) {
        if (javaType == Integer.class || javaType == int.class
                || javaType == Short.class || javaType == short.class) {
            return INTEGER;
        }
        if (javaType == Long.class || javaType == long.class) {
            return LONG;
        }
        if (javaType == Double.class || javaType == double.class
                || javaType == Float.class || javaType == float.class) {
            return DOUBLE;
        }
        if (javaType == String.class) {
            return STRING;
        }
        if (javaType == Boolean.class || javaType == boolean.class) {
            return BOOLEAN;
        }
        if (javaType == LocalDate.class) {
            return DATE;
        }
        if (javaType == LocalDateTime.class) {
            return DATETIME;
        }
        throw new IllegalArgumentException("No column type for Java type " + javaType.getName());
    }
}
