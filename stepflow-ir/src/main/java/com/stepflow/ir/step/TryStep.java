package com.stepflow.ir.step;

import com.stepflow.compiler.ast.stmt.RetryPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Try 步骤
 */
public class TryStep extends WorkflowStep {
    private final List<WorkflowStep> trySteps;
    private final RetryPolicy retryPolicy;       // 可选
    private final String errorVariable;          // 可选
    private final List<WorkflowStep> exceptSteps; // 可选

    public TryStep(String name, List<WorkflowStep> trySteps, RetryPolicy retryPolicy,
                   String errorVariable, List<WorkflowStep> exceptSteps) {
        super(name);
        this.trySteps = Collections.unmodifiableList(new ArrayList<>(trySteps));
        this.retryPolicy = retryPolicy;
        this.errorVariable = errorVariable;
        this.exceptSteps = exceptSteps != null ? Collections.unmodifiableList(new ArrayList<>(exceptSteps)) : null;
    }

    public List<WorkflowStep> getTrySteps() {
        return trySteps;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public String getErrorVariable() {
        return errorVariable;
    }

    public List<WorkflowStep> getExceptSteps() {
        return exceptSteps;
    }

    public boolean hasExcept() {
        return exceptSteps != null;
    }

    public TryStep withSteps(List<WorkflowStep> newTrySteps, List<WorkflowStep> newExceptSteps) {
        return new TryStep(name, newTrySteps, retryPolicy, errorVariable, newExceptSteps);
    }

    @Override
    public TryStep withName(String newName) {
        return new TryStep(newName, trySteps, retryPolicy, errorVariable, exceptSteps);
    }

    @Override
    public String getNamePrefix() {
        return "try";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitTry(this, context);
    }
}
