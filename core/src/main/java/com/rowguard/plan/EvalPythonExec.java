package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.FunctionCall;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates python UDFs in a worker process, row-batched ({@link NodeKind#BATCH_EVAL_PYTHON})
 * or through arrow record batches ({@link NodeKind#ARROW_EVAL_PYTHON}).
 */
public final class EvalPythonExec extends UnaryExec {

    /**
     * Evaluation type of a python UDF.
     */
    public enum EvalType {
        SQL_BATCHED_UDF,
        SQL_SCALAR_PANDAS_UDF,
        SQL_GROUPED_MAP_PANDAS_UDF,
        SQL_GROUPED_AGG_PANDAS_UDF
    }

    private final NodeKind kind;
    private final List<FunctionCall> udfs;
    private final List<AttributeReference> resultAttrs;
    private final EvalType evalType;

    public EvalPythonExec(NodeKind kind, List<FunctionCall> udfs, List<AttributeReference> resultAttrs,
                          EvalType evalType, PhysicalPlan child) {
        super(child);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (kind != NodeKind.BATCH_EVAL_PYTHON && kind != NodeKind.ARROW_EVAL_PYTHON) {
            throw new IllegalArgumentException("Not a python eval kind: " + kind);
        }
        this.udfs = List.copyOf(udfs);
        this.resultAttrs = List.copyOf(resultAttrs);
        this.evalType = Objects.requireNonNull(evalType, "evalType must not be null");
    }

    public List<FunctionCall> udfs() {
        return udfs;
    }

    public List<AttributeReference> resultAttrs() {
        return resultAttrs;
    }

    public EvalType evalType() {
        return evalType;
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    @Override
    public List<AttributeReference> output() {
        List<AttributeReference> fields = new ArrayList<>(child().output());
        fields.addAll(resultAttrs);
        return fields;
    }

    @Override
    public List<Expression> expressions() {
        return List.copyOf(udfs);
    }

    @Override
    protected EvalPythonExec withNewChild(PhysicalPlan newChild) {
        return new EvalPythonExec(kind, udfs, resultAttrs, evalType, newChild);
    }

    @Override
    public String toString() {
        return nodeName() + " " + udfs + ", " + resultAttrs + ", " + evalType;
    }
}
