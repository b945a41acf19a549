package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a function call such as {@code avg(salary)} or
 * {@code mod(id, 2)}.
 *
 * Arity and argument types are checked when the owning clause is appended,
 * so an ill-typed call can exist as a value but never enters a pipeline.
 *
 * @param function  The function being called
 * @param arguments The call arguments, in order
 */
public record FunctionExpression(
        Function function,
        List<Expression> arguments) implements Expression {

    /**
     * Functions known to the builder.
     */
    public enum Function {
        COUNT("count", 1, true),
        SUM("sum", 1, true),
        AVG("avg", 1, true),
        MIN("min", 1, true),
        MAX("max", 1, true),
        MODULO("mod", 2, false),
        POWER("pow", 2, false);

        private final String pureName;
        private final int arity;
        private final boolean aggregate;

        Function(String pureName, int arity, boolean aggregate) {
            this.pureName = pureName;
            this.arity = arity;
            this.aggregate = aggregate;
        }

        public String pureName() {
            return pureName;
        }

        public int arity() {
            return arity;
        }

        public boolean isAggregate() {
            return aggregate;
        }
    }

    public FunctionExpression {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(arguments, "Arguments cannot be null");
        arguments = List.copyOf(arguments);
    }

    public static FunctionExpression of(Function function, Expression... arguments) {
        return new FunctionExpression(function, List.of(arguments));
    }

    public boolean isAggregate() {
        return function.isAggregate();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
