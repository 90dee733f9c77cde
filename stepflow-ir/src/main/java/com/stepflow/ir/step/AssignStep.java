package com.stepflow.ir.step;

import com.stepflow.compiler.ast.stmt.Assignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 赋值步骤
 */
public class AssignStep extends WorkflowStep {
    private final List<Assignment> assignments;
    private final String next;  // 可选

    public AssignStep(String name, List<Assignment> assignments, String next) {
        super(name);
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
        this.next = next;
    }

    public AssignStep(List<Assignment> assignments) {
        this(null, assignments, null);
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    public String getNext() {
        return next;
    }

    public boolean hasNext() {
        return next != null;
    }

    public AssignStep withNext(String newNext) {
        return new AssignStep(name, assignments, newNext);
    }

    public AssignStep withAssignments(List<Assignment> newAssignments) {
        return new AssignStep(name, newAssignments, next);
    }

    @Override
    public AssignStep withName(String newName) {
        return new AssignStep(newName, assignments, next);
    }

    @Override
    public String getNamePrefix() {
        return "assign";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
