package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Try 语句
 */
public class TryStmt extends Statement {
    private final List<Statement> body;
    private final List<Statement> catchBody;    // 可选
    private final String errorVariable;         // 可选
    private final RetryPolicy retryPolicy;      // 可选
    private final List<Statement> finallyBody;  // 可选

    public TryStmt(SourceLocation location, List<Statement> body, List<Statement> catchBody,
                   String errorVariable, RetryPolicy retryPolicy, List<Statement> finallyBody) {
        super(location);
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.catchBody = catchBody != null ? Collections.unmodifiableList(new ArrayList<>(catchBody)) : null;
        this.errorVariable = errorVariable;
        this.retryPolicy = retryPolicy;
        this.finallyBody = finallyBody != null ? Collections.unmodifiableList(new ArrayList<>(finallyBody)) : null;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getCatchBody() {
        return catchBody;
    }

    public boolean hasCatch() {
        return catchBody != null;
    }

    public String getErrorVariable() {
        return errorVariable;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public boolean hasRetryPolicy() {
        return retryPolicy != null;
    }

    public List<Statement> getFinallyBody() {
        return finallyBody;
    }

    public boolean hasFinally() {
        return finallyBody != null;
    }

    public TryStmt withBodies(List<Statement> body, List<Statement> catchBody, List<Statement> finallyBody) {
        return new TryStmt(location, body, catchBody, errorVariable, retryPolicy, finallyBody);
    }

    public TryStmt withRetryPolicy(RetryPolicy policy) {
        return new TryStmt(location, body, catchBody, errorVariable, policy, finallyBody);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitTry(this, context);
    }
}
