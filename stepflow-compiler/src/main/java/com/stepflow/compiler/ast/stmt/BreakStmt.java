package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * Break 语句
 */
public class BreakStmt extends Statement {
    private final String label;  // 可选

    public BreakStmt(SourceLocation location, String label) {
        super(location);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean hasLabel() {
        return label != null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitBreak(this, context);
    }
}
