package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * 变量引用
 */
public class VariableRef extends Expression {
    private final String name;

    public VariableRef(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public VariableRef(String name) {
        this(null, name);
    }

    public String getName() {
        return name;
    }

    /** 前端把 undefined 作为普通标识符传入 */
    public boolean isUndefined() {
        return "undefined".equals(name);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
