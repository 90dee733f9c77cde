package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 区间循环：for value in [start, end]
 */
public class ForRangeStmt extends Statement {
    private final String loopVariable;
    private final Expression rangeStart;
    private final Expression rangeEnd;
    private final List<Statement> body;

    public ForRangeStmt(SourceLocation location, String loopVariable,
                        Expression rangeStart, Expression rangeEnd, List<Statement> body) {
        super(location);
        this.loopVariable = loopVariable;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getLoopVariable() {
        return loopVariable;
    }

    public Expression getRangeStart() {
        return rangeStart;
    }

    public Expression getRangeEnd() {
        return rangeEnd;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitForRange(this, context);
    }
}
