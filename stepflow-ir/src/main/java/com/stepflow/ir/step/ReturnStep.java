package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;

/**
 * 返回步骤，无返回值时输出为 next: end
 */
public class ReturnStep extends WorkflowStep {
    private final Expression value;  // 可选

    public ReturnStep(String name, Expression value) {
        super(name);
        this.value = value;
    }

    public ReturnStep(Expression value) {
        this(null, value);
    }

    public Expression getValue() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    public ReturnStep withValue(Expression newValue) {
        return new ReturnStep(name, newValue);
    }

    @Override
    public ReturnStep withName(String newName) {
        return new ReturnStep(newName, value);
    }

    @Override
    public String getNamePrefix() {
        return "return";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
