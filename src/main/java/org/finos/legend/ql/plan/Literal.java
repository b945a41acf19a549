package org.finos.legend.ql.plan;

import org.finos.legend.ql.store.ColumnType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Represents a literal value in a query.
 *
 * @param value The literal value
 * @param type  The semantic type of the value
 */
public record Literal(
        Object value,
        ColumnType type) implements Expression {

    public Literal {
        Objects.requireNonNull(value, "Literal value cannot be null");
        Objects.requireNonNull(type, "Literal type cannot be null");

        // Validate type matches value
        switch (type) {
            case INTEGER -> {
                if (!(value instanceof Integer)) {
                    throw new IllegalArgumentException("INTEGER literal must have Integer value");
                }
            }
            case LONG -> {
                if (!(value instanceof Long)) {
                    throw new IllegalArgumentException("LONG literal must have Long value");
                }
            }
            case DOUBLE -> {
                if (!(value instanceof Double)) {
                    throw new IllegalArgumentException("DOUBLE literal must have Double value");
                }
            }
            case STRING -> {
                if (!(value instanceof String)) {
                    throw new IllegalArgumentException("STRING literal must have String value");
                }
            }
            case BOOLEAN -> {
                if (!(value instanceof Boolean)) {
                    throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                }
            }
            case DATE -> {
                if (!(value instanceof LocalDate)) {
                    throw new IllegalArgumentException("DATE literal must have LocalDate value");
                }
            }
            case DATETIME -> {
                if (!(value instanceof LocalDateTime)) {
                    throw new IllegalArgumentException("DATETIME literal must have LocalDateTime value");
                }
            }
        }
    }

    public static Literal integer(int value) {
        return new Literal(value, ColumnType.INTEGER);
    }

    public static Literal bigint(long value) {
        return new Literal(value, ColumnType.LONG);
    }

    public static Literal decimal(double value) {
        return new Literal(value, ColumnType.DOUBLE);
    }

    public static Literal string(String value) {
        return new Literal(value, ColumnType.STRING);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, ColumnType.BOOLEAN);
    }

    public static Literal date(LocalDate value) {
        return new Literal(value, ColumnType.DATE);
    }

    public static Literal dateTime(LocalDateTime value) {
        return new Literal(value, ColumnType.DATETIME);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        if (type == ColumnType.STRING) {
            return "'" + value + "'";
        }
        return String.valueOf(value);
    }
}
