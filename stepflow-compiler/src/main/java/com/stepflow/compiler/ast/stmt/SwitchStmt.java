package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Switch 语句。前端已把判别式编译为各 case 的条件；case 体按顺序贯穿执行。
 */
public class SwitchStmt extends Statement {
    private final List<ConditionalBranch> cases;

    public SwitchStmt(SourceLocation location, List<ConditionalBranch> cases) {
        super(location);
        this.cases = Collections.unmodifiableList(new ArrayList<>(cases));
    }

    public List<ConditionalBranch> getCases() {
        return cases;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitSwitch(this, context);
    }
}
