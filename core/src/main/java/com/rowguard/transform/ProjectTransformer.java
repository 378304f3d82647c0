package com.rowguard.transform;

import com.rowguard.plan.ProjectExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native projection.
 */
public final class ProjectTransformer extends TransformCandidate {

    private final ProjectExec project;

    public ProjectTransformer(ProjectExec project, TransformContext context) {
        super(project, context);
        this.project = project;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        converter.convertAll(project.projectList());
        return ValidationOutcome.passed();
    }
}
