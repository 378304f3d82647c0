package com.rowguard.plan;

import com.rowguard.expression.Alias;
import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;

import java.util.List;

/**
 * Physical projection: computes a list of named expressions per input row.
 *
 * <p>Each project list entry is either an {@link AttributeReference} passed through or an
 * {@link Alias} naming a computed value.
 */
public final class ProjectExec extends UnaryExec {

    private final List<Expression> projectList;

    public ProjectExec(List<Expression> projectList, PhysicalPlan child) {
        super(child);
        this.projectList = List.copyOf(projectList);
        for (Expression e : this.projectList) {
            if (!(e instanceof AttributeReference) && !(e instanceof Alias)) {
                throw new IllegalArgumentException("project list entries must be named: " + e);
            }
        }
    }

    public List<Expression> projectList() {
        return projectList;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROJECT;
    }

    @Override
    public List<AttributeReference> output() {
        return toAttributes(projectList);
    }

    @Override
    public List<Expression> expressions() {
        return projectList;
    }

    @Override
    protected ProjectExec withNewChild(PhysicalPlan newChild) {
        return new ProjectExec(projectList, newChild);
    }

    /**
     * Maps named expressions to the attributes they produce.
     *
     * @param named attributes or aliases
     * @return the produced attributes
     */
    static List<AttributeReference> toAttributes(List<? extends Expression> named) {
        return named.stream()
            .map(e -> e instanceof Alias ? ((Alias) e).toAttribute() : (AttributeReference) e)
            .toList();
    }

    @Override
    public String toString() {
        return "Project " + projectList;
    }
}
