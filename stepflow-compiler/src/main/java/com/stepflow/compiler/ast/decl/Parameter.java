package com.stepflow.compiler.ast.decl;

import com.stepflow.compiler.ast.AstNode;
import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

/**
 * 函数参数
 */
public class Parameter extends AstNode {
    private final String name;
    private final Expression defaultValue;  // 可选，必须是字面量

    public Parameter(SourceLocation location, String name, Expression defaultValue) {
        super(location);
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public Parameter(String name) {
        this(null, name, null);
    }

    public String getName() {
        return name;
    }

    public Expression getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }
}
