package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;

/**
 * 抛出异常步骤
 */
public class RaiseStep extends WorkflowStep {
    private final Expression value;

    public RaiseStep(String name, Expression value) {
        super(name);
        this.value = value;
    }

    public RaiseStep(Expression value) {
        this(null, value);
    }

    public Expression getValue() {
        return value;
    }

    public RaiseStep withValue(Expression newValue) {
        return new RaiseStep(name, newValue);
    }

    @Override
    public RaiseStep withName(String newName) {
        return new RaiseStep(newName, value);
    }

    @Override
    public String getNamePrefix() {
        return "raise";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitRaise(this, context);
    }
}
