package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.expr.Expression;

/**
 * 单个赋值：target = value
 */
public final class Assignment {
    private final Expression target;
    private final Expression value;

    public Assignment(Expression target, Expression value) {
        this.target = target;
        this.value = value;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }
}
