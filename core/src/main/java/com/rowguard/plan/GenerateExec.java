package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.FunctionCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies a generator ({@code explode}, {@code posexplode}, {@code inline}, ...) to every
 * input row, producing zero or more output rows per input row.
 */
public final class GenerateExec extends UnaryExec {

    private final FunctionCall generator;
    private final List<AttributeReference> requiredChildOutput;
    private final boolean outer;
    private final List<AttributeReference> generatorOutput;

    public GenerateExec(FunctionCall generator, List<AttributeReference> requiredChildOutput, boolean outer,
                        List<AttributeReference> generatorOutput, PhysicalPlan child) {
        super(child);
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.requiredChildOutput = List.copyOf(requiredChildOutput);
        this.outer = outer;
        this.generatorOutput = List.copyOf(generatorOutput);
    }

    public FunctionCall generator() {
        return generator;
    }

    public List<AttributeReference> requiredChildOutput() {
        return requiredChildOutput;
    }

    public boolean outer() {
        return outer;
    }

    public List<AttributeReference> generatorOutput() {
        return generatorOutput;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GENERATE;
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> fields = new ArrayList<>(requiredChildOutput);
        fields.addAll(generatorOutput);
        return fields;
    }

    @Override
    public List<Expression> expressions() {
        return List.of(generator);
    }

    @Override
    protected GenerateExec withNewChild(PhysicalPlan newChild) {
        return new GenerateExec(generator, requiredChildOutput, outer, generatorOutput, newChild);
    }

    @Override
    public String toString() {
        return "Generate " + generator + (outer ? ", outer" : "") + ", " + generatorOutput;
    }
}
