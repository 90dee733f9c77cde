package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用（限定名 + 位置参数）
 */
public class FunctionInvocationExpr extends Expression {
    private final String functionName;
    private final List<Expression> arguments;

    public FunctionInvocationExpr(SourceLocation location, String functionName, List<Expression> arguments) {
        super(location);
        this.functionName = functionName;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public FunctionInvocationExpr(String functionName, List<Expression> arguments) {
        this(null, functionName, arguments);
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitInvocation(this);
    }
}
