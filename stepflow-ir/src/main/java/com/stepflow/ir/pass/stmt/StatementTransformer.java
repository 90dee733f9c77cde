package com.stepflow.ir.pass.stmt;

import com.stepflow.compiler.ast.stmt.ConditionalBranch;
import com.stepflow.compiler.ast.stmt.DoWhileStmt;
import com.stepflow.compiler.ast.stmt.ForInStmt;
import com.stepflow.compiler.ast.stmt.ForRangeStmt;
import com.stepflow.compiler.ast.stmt.ForStmt;
import com.stepflow.compiler.ast.stmt.IfStmt;
import com.stepflow.compiler.ast.stmt.LabelledStmt;
import com.stepflow.compiler.ast.stmt.ParallelStmt;
import com.stepflow.compiler.ast.stmt.Statement;
import com.stepflow.compiler.ast.stmt.SwitchStmt;
import com.stepflow.compiler.ast.stmt.TryStmt;
import com.stepflow.compiler.ast.stmt.WhileStmt;

import java.util.ArrayList;
import java.util.List;

/**
 * 语句树变换基类：递归重建所有嵌套语句块。
 */
public abstract class StatementTransformer {

    public List<Statement> transformBlock(List<Statement> stmts) {
        List<Statement> result = new ArrayList<>(stmts.size());
        for (Statement stmt : stmts) {
            result.add(transformStmt(stmt));
        }
        return result;
    }

    protected Statement transformStmt(Statement stmt) {
        if (stmt instanceof IfStmt) {
            IfStmt s = (IfStmt) stmt;
            return new IfStmt(s.getLocation(), transformBranches(s.getBranches()));
        }
        if (stmt instanceof SwitchStmt) {
            SwitchStmt s = (SwitchStmt) stmt;
            return new SwitchStmt(s.getLocation(), transformBranches(s.getCases()));
        }
        if (stmt instanceof ForStmt) {
            ForStmt s = (ForStmt) stmt;
            return new ForStmt(s.getLocation(), s.getLoopVariable(), s.getIndexVariable(),
                    s.getIterable(), transformBlock(s.getBody()));
        }
        if (stmt instanceof ForRangeStmt) {
            ForRangeStmt s = (ForRangeStmt) stmt;
            return new ForRangeStmt(s.getLocation(), s.getLoopVariable(),
                    s.getRangeStart(), s.getRangeEnd(), transformBlock(s.getBody()));
        }
        if (stmt instanceof ForInStmt) {
            ForInStmt s = (ForInStmt) stmt;
            return new ForInStmt(s.getLocation(), s.getLoopVariable(), s.getObject(), transformBlock(s.getBody()));
        }
        if (stmt instanceof WhileStmt) {
            WhileStmt s = (WhileStmt) stmt;
            return new WhileStmt(s.getLocation(), s.getCondition(), transformBlock(s.getBody()));
        }
        if (stmt instanceof DoWhileStmt) {
            DoWhileStmt s = (DoWhileStmt) stmt;
            return new DoWhileStmt(s.getLocation(), transformBlock(s.getBody()), s.getCondition());
        }
        if (stmt instanceof TryStmt) {
            TryStmt s = (TryStmt) stmt;
            return s.withBodies(transformBlock(s.getBody()),
                    s.hasCatch() ? transformBlock(s.getCatchBody()) : null,
                    s.hasFinally() ? transformBlock(s.getFinallyBody()) : null);
        }
        if (stmt instanceof LabelledStmt) {
            LabelledStmt s = (LabelledStmt) stmt;
            return new LabelledStmt(s.getLocation(), s.getLabel(), transformBlock(s.getBody()));
        }
        if (stmt instanceof ParallelStmt) {
            ParallelStmt s = (ParallelStmt) stmt;
            if (s.isForLoop()) {
                return s.withBranches(null, transformStmt(s.getForLoop()));
            }
            List<List<Statement>> branches = new ArrayList<>();
            for (List<Statement> branch : s.getBranches()) {
                branches.add(transformBlock(branch));
            }
            return s.withBranches(branches, null);
        }
        return stmt;
    }

    private List<ConditionalBranch> transformBranches(List<ConditionalBranch> branches) {
        List<ConditionalBranch> result = new ArrayList<>();
        for (ConditionalBranch b : branches) {
            result.add(new ConditionalBranch(b.getCondition(), transformBlock(b.getBody())));
        }
        return result;
    }
}
