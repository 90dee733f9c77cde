package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * If 语句（if / else if / else 展平为分支列表）
 */
public class IfStmt extends Statement {
    private final List<ConditionalBranch> branches;

    public IfStmt(SourceLocation location, List<ConditionalBranch> branches) {
        super(location);
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
    }

    public List<ConditionalBranch> getBranches() {
        return branches;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
