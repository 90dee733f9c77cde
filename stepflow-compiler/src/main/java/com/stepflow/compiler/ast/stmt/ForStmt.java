package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * For-of 语句
 */
public class ForStmt extends Statement {
    private final String loopVariable;
    private final String indexVariable;  // 可选
    private final Expression iterable;
    private final List<Statement> body;

    public ForStmt(SourceLocation location, String loopVariable, String indexVariable,
                   Expression iterable, List<Statement> body) {
        super(location);
        this.loopVariable = loopVariable;
        this.indexVariable = indexVariable;
        this.iterable = iterable;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getLoopVariable() {
        return loopVariable;
    }

    public String getIndexVariable() {
        return indexVariable;
    }

    public boolean hasIndexVariable() {
        return indexVariable != null;
    }

    public Expression getIterable() {
        return iterable;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFor(this, context);
    }
}
