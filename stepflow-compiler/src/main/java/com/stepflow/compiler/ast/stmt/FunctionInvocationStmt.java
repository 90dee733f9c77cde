package com.stepflow.compiler.ast.stmt;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作为独立语句的函数调用（call 步骤），参数为命名参数
 */
public class FunctionInvocationStmt extends Statement {
    private final String callee;
    private final Map<String, Expression> arguments;
    private final String resultVariable;  // 可选

    public FunctionInvocationStmt(SourceLocation location, String callee,
                                  Map<String, Expression> arguments, String resultVariable) {
        super(location);
        this.callee = callee;
        this.arguments = Collections.unmodifiableMap(
                arguments != null ? new LinkedHashMap<>(arguments) : new LinkedHashMap<String, Expression>());
        this.resultVariable = resultVariable;
    }

    public String getCallee() {
        return callee;
    }

    public Map<String, Expression> getArguments() {
        return arguments;
    }

    public String getResultVariable() {
        return resultVariable;
    }

    public boolean hasResultVariable() {
        return resultVariable != null;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitInvocation(this, context);
    }
}
