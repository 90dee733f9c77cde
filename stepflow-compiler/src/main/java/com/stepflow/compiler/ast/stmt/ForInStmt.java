package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * For-in 语句（不受支持，降级时报错）
 */
public class ForInStmt extends Statement {
    private final String loopVariable;
    private final Expression object;
    private final List<Statement> body;

    public ForInStmt(SourceLocation location, String loopVariable, Expression object, List<Statement> body) {
        super(location);
        this.loopVariable = loopVariable;
        this.object = object;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getLoopVariable() {
        return loopVariable;
    }

    public Expression getObject() {
        return object;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForIn(this, context);
    }
}
