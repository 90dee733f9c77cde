package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一组赋值（let a = 1, b = 2 之类）
 */
public class AssignStmt extends Statement {
    private final List<Assignment> assignments;

    public AssignStmt(SourceLocation location, List<Assignment> assignments) {
        super(location);
        this.assignments = Collections.unmodifiableList(new ArrayList<>(assignments));
    }

    public List<Assignment> getAssignments() {
        return assignments;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
