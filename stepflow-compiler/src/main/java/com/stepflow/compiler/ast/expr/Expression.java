package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.AstNode;
import com.stepflow.compiler.ast.SourceLocation;

/**
 * 表达式基类（不可变）
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R> R accept(ExprVisitor<R> visitor);

    /** 不带 ${} 的文本形式 */
    @Override
    public String toString() {
        return ExpressionRenderer.render(this);
    }
}
