package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.error.InternalTranspilerException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Switch 步骤的一个分支：条件 + 嵌套步骤 和/或 跳转目标
 */
public final class SwitchBranch {
    private final Expression condition;
    private final List<WorkflowStep> steps;
    private final String next;  // 可选

    public SwitchBranch(Expression condition, List<WorkflowStep> steps, String next) {
        if (steps == null && next == null) {
            throw new InternalTranspilerException("switch branch has neither steps nor next");
        }
        this.condition = condition;
        this.steps = steps != null
                ? Collections.unmodifiableList(new ArrayList<>(steps))
                : Collections.<WorkflowStep>emptyList();
        this.next = next;
    }

    public Expression getCondition() {
        return condition;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public String getNext() {
        return next;
    }

    public boolean hasNext() {
        return next != null;
    }

    public SwitchBranch withSteps(List<WorkflowStep> newSteps) {
        return new SwitchBranch(condition, newSteps, next);
    }

    public SwitchBranch withNext(String newNext) {
        return new SwitchBranch(condition, steps, newNext);
    }

    public SwitchBranch withCondition(Expression newCondition) {
        return new SwitchBranch(newCondition, steps, next);
    }
}
