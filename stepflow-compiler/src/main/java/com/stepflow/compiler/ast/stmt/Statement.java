package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.AstNode;
import com.stepflow.compiler.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StmtVisitor<R, C> visitor, C context);
}
