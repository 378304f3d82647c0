package com.rowguard.transform;

import com.rowguard.backend.BackendSettings;
import com.rowguard.exception.NotSupportedException;
import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.FunctionCall;
import com.rowguard.types.DataType;
import com.rowguard.types.MapType;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Checks that expressions can be expressed in the native backend.
 *
 * <p>Every function in the tree must be known to the backend and every intermediate
 * result type must be representable. Violations raise {@link NotSupportedException},
 * which the dispatch turns into a fallback tag.
 */
public final class ExpressionConverter {

    private final BackendSettings backend;

    public ExpressionConverter(BackendSettings backend) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    /**
     * Checks an expression tree.
     *
     * @param expression the expression
     * @throws NotSupportedException if a function or type is not supported
     */
    public void convert(Expression expression) {
        if (expression instanceof FunctionCall call) {
            String name = call.functionName().toLowerCase(Locale.ROOT);
            if (!backend.supportsFunction(name)) {
                throw new NotSupportedException("Function " + name + " is not supported by the backend");
            }
        }
        checkType(expression.dataType(), expression.prettyName());
        for (Expression child : expression.children()) {
            convert(child);
        }
    }

    public void convertAll(List<? extends Expression> expressions) {
        for (Expression expression : expressions) {
            convert(expression);
        }
    }

    /**
     * Checks the arguments of a call without requiring the backend to know the function
     * itself, as for python UDFs evaluated outside the backend.
     *
     * @param call the call
     */
    public void convertArguments(FunctionCall call) {
        convertAll(call.arguments());
        checkType(call.dataType(), call.functionName());
    }

    public void checkAttributes(List<AttributeReference> attributes) {
        for (AttributeReference attribute : attributes) {
            checkType(attribute.dataType(), attribute.name());
        }
    }

    /**
     * Rejects map-typed keys, which the backend cannot hash or compare.
     *
     * @param keys key expressions
     * @param role what the keys are used for, for the error message
     */
    public static void checkNotMapTyped(List<? extends Expression> keys, String role) {
        for (Expression key : keys) {
            if (key.dataType() instanceof MapType) {
                throw new NotSupportedException("Map type is not supported as " + role + ": " + key);
            }
        }
    }

    private void checkType(DataType dataType, String context) {
        if (!backend.supportsType(dataType)) {
            throw new NotSupportedException("Type " + dataType.typeName() + " is not supported", context);
        }
    }
}
