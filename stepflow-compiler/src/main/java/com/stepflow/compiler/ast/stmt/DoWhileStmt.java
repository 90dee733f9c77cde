package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Do-While 语句
 */
public class DoWhileStmt extends Statement {
    private final List<Statement> body;
    private final Expression condition;

    public DoWhileStmt(SourceLocation location, List<Statement> body, Expression condition) {
        super(location);
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.condition = condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    public Expression getCondition() {
        return condition;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitDoWhile(this, context);
    }
}
