package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 带标签的语句块
 */
public class LabelledStmt extends Statement {
    private final String label;
    private final List<Statement> body;

    public LabelledStmt(SourceLocation location, String label, List<Statement> body) {
        super(location);
        this.label = label;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getLabel() {
        return label;
    }

    public List<Statement> getBody() {
        return body;
    }

    /** 标签直接修饰一个循环时返回该循环 */
    public Statement getLabelledLoop() {
        if (body.size() != 1) return null;
        Statement s = body.get(0);
        if (s instanceof ForStmt || s instanceof ForRangeStmt
                || s instanceof WhileStmt || s instanceof DoWhileStmt) {
            return s;
        }
        return null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitLabelled(this, context);
    }
}
