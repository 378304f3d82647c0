package com.rowguard.transform;

import com.rowguard.expression.FunctionCall;
import com.rowguard.plan.EvalPythonExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Python UDF evaluation driven by the native engine. Only scalar UDFs qualify.
 */
public final class EvalPythonTransformer extends TransformCandidate {

    private final EvalPythonExec eval;

    public EvalPythonTransformer(EvalPythonExec eval, TransformContext context) {
        super(eval, context);
        this.eval = eval;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        EvalPythonExec.EvalType type = eval.evalType();
        if (type != EvalPythonExec.EvalType.SQL_BATCHED_UDF && type != EvalPythonExec.EvalType.SQL_SCALAR_PANDAS_UDF) {
            return ValidationOutcome.failed("Only scalar python UDFs are supported, got " + type);
        }
        for (FunctionCall udf : eval.udfs()) {
            converter.convertArguments(udf);
        }
        return ValidationOutcome.passed();
    }
}
