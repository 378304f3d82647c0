package com.rowguard.plan;

import com.rowguard.expression.AttributeReference;

import java.util.List;

/**
 * Root of a subtree already committed to the native engine.
 *
 * <p>Fallback rules leave committed subtrees alone.
 */
public final class NativeStageExec extends UnaryExec {

    private final int transformStageId;

    public NativeStageExec(int transformStageId, PhysicalPlan child) {
        super(child);
        this.transformStageId = transformStageId;
    }

    public int transformStageId() {
        return transformStageId;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NATIVE_STAGE;
    }

    @Override
    public boolean isNative() {
        return true;
    }

    @Override
    public List<AttributeReference> output() {
        return child().output();
    }

    @Override
    protected NativeStageExec withNewChild(PhysicalPlan newChild) {
        return new NativeStageExec(transformStageId, newChild);
    }

    @Override
    public String toString() {
        return "NativeStage(" + transformStageId + ")";
    }
}
