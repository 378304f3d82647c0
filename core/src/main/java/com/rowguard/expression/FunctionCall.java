package com.rowguard.expression;

import com.rowguard.types.DataType;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A call by name. Operators ({@code >}, {@code +}), scalar functions, aggregates,
 * window functions, generators and python UDFs are all represented this way; the
 * backend decides by name whether it can evaluate the call.
 *
 * @param functionName the name the backend looks the function up by
 * @param arguments the arguments, in order
 * @param dataType the result type
 * @param nullable whether the result may be null
 */
public record FunctionCall(String functionName, List<Expression> arguments, DataType dataType, boolean nullable)
        implements Expression {

    public FunctionCall {
        Objects.requireNonNull(functionName, "functionName must not be null");
        if (functionName.isBlank()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        arguments = List.copyOf(Objects.requireNonNull(arguments, "arguments must not be null"));
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public FunctionCall(String functionName, List<Expression> arguments, DataType dataType) {
        this(functionName, arguments, dataType, true);
    }

    public static FunctionCall of(String functionName, DataType dataType, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments), dataType);
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }

    @Override
    public String prettyName() {
        return functionName.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return functionName + arguments;
    }
}
