package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * While 语句
 */
public class WhileStmt extends Statement {
    private final Expression condition;
    private final List<Statement> body;

    public WhileStmt(SourceLocation location, Expression condition, List<Statement> body) {
        super(location);
        this.condition = condition;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public Expression getCondition() {
        return condition;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
