package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 条件分支：if 的一支，或 switch 的一个 case（default 的条件为字面量 true）
 */
public final class ConditionalBranch {
    private final Expression condition;
    private final List<Statement> body;

    public ConditionalBranch(Expression condition, List<Statement> body) {
        this.condition = condition;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }
}
