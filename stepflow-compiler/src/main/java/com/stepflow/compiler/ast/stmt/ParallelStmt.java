package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 并行区域：若干分支，或一个并行 for 循环
 */
public class ParallelStmt extends Statement {
    private final List<List<Statement>> branches;
    private final Statement forLoop;             // ForStmt 或 ForRangeStmt，与 branches 互斥
    private final List<String> shared;           // 可选
    private final Integer concurrencyLimit;      // 可选
    private final String exceptionPolicy;        // 可选

    public ParallelStmt(SourceLocation location, List<List<Statement>> branches, Statement forLoop,
                        List<String> shared, Integer concurrencyLimit, String exceptionPolicy) {
        super(location);
        if ((branches == null) == (forLoop == null)) {
            throw new IllegalArgumentException("parallel needs either branches or a for loop");
        }
        if (forLoop != null && !(forLoop instanceof ForStmt || forLoop instanceof ForRangeStmt)) {
            throw new IllegalArgumentException("parallel loop must be a for statement");
        }
        List<List<Statement>> copy = null;
        if (branches != null) {
            copy = new ArrayList<>();
            for (List<Statement> branch : branches) {
                copy.add(Collections.unmodifiableList(new ArrayList<>(branch)));
            }
            copy = Collections.unmodifiableList(copy);
        }
        this.branches = copy;
        this.forLoop = forLoop;
        this.shared = shared != null ? Collections.unmodifiableList(new ArrayList<>(shared)) : null;
        this.concurrencyLimit = concurrencyLimit;
        this.exceptionPolicy = exceptionPolicy;
    }

    public static ParallelStmt branches(SourceLocation location, List<List<Statement>> branches) {
        return new ParallelStmt(location, branches, null, null, null, null);
    }

    public static ParallelStmt forLoop(SourceLocation location, Statement forLoop) {
        return new ParallelStmt(location, null, forLoop, null, null, null);
    }

    public List<List<Statement>> getBranches() {
        return branches;
    }

    public boolean isForLoop() {
        return forLoop != null;
    }

    public Statement getForLoop() {
        return forLoop;
    }

    public List<String> getShared() {
        return shared;
    }

    public Integer getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public String getExceptionPolicy() {
        return exceptionPolicy;
    }

    public ParallelStmt withBranches(List<List<Statement>> newBranches, Statement newForLoop) {
        return new ParallelStmt(location, newBranches, newForLoop, shared, concurrencyLimit, exceptionPolicy);
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitParallel(this, context);
    }
}
