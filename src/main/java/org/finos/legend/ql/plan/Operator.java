package org.finos.legend.ql.plan;

/**
 * Operators usable in unary and binary expressions.
 *
 * The category decides which operand types are legal; the symbol is the
 * Pure relation token the operator renders as.
 */
public enum Operator {
    // Comparison
    EQUALS("==", Category.COMPARISON, 2),
    NOT_EQUALS("!=", Category.COMPARISON, 2),
    LESS_THAN("<", Category.COMPARISON, 2),
    LESS_THAN_OR_EQUALS("<=", Category.COMPARISON, 2),
    GREATER_THAN(">", Category.COMPARISON, 2),
    GREATER_THAN_OR_EQUALS(">=", Category.COMPARISON, 2),
    LIKE("like", Category.COMPARISON, 2),
    IS_NULL("is null", Category.COMPARISON, 1),
    IS_NOT_NULL("is not null", Category.COMPARISON, 1),
    IN("in", Category.COMPARISON, 2),
    NOT_IN("notIn", Category.COMPARISON, 2),
    // Logical
    AND("&&", Category.LOGICAL, 2),
    OR("||", Category.LOGICAL, 2),
    NOT("not", Category.LOGICAL, 1),
    // Arithmetic
    ADD("+", Category.ARITHMETIC, 2),
    SUBTRACT("-", Category.ARITHMETIC, 2),
    MULTIPLY("*", Category.ARITHMETIC, 2),
    DIVIDE("/", Category.ARITHMETIC, 2),
    MODULO("mod", Category.ARITHMETIC, 2),
    POWER("pow", Category.ARITHMETIC, 2),
    // Bitwise
    BITWISE_AND("&", Category.BITWISE, 2),
    BITWISE_OR("|", Category.BITWISE, 2);

    public enum Category {
        COMPARISON,
        LOGICAL,
        ARITHMETIC,
        BITWISE
    }

    private final String symbol;
    private final Category category;
    private final int arity;

    Operator(String symbol, Category category, int arity) {
        this.symbol = symbol;
        this.category = category;
        this.arity = arity;
    }

    /**
     * @return The Pure relation token for this operator
     */
    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public boolean isUnary() {
        return arity == 1;
    }

    /**
     * @return true for the comparisons that need an ordered type (<, <=, >, >=)
     */
    public boolean isOrderingComparison() {
        return switch (this) {
            case LESS_THAN, LESS_THAN_OR_EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUALS -> true;
            default -> false;
        };
    }

    /**
     * MOD and POW have no infix form in Pure and render as calls.
     */
    public boolean rendersAsCall() {
        return this == MODULO || this == POWER;
    }
}
