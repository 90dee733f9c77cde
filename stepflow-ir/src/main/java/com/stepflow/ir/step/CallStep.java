package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 函数调用步骤
 */
public class CallStep extends WorkflowStep {
    private final String call;
    private final Map<String, Expression> args;
    private final String result;  // 可选

    public CallStep(String name, String call, Map<String, Expression> args, String result) {
        super(name);
        this.call = call;
        this.args = Collections.unmodifiableMap(
                args != null ? new LinkedHashMap<>(args) : new LinkedHashMap<String, Expression>());
        this.result = result;
    }

    public String getCall() {
        return call;
    }

    public Map<String, Expression> getArgs() {
        return args;
    }

    public String getResult() {
        return result;
    }

    public CallStep withArgs(Map<String, Expression> newArgs) {
        return new CallStep(name, call, newArgs, result);
    }

    @Override
    public CallStep withName(String newName) {
        return new CallStep(newName, call, args, result);
    }

    /** 例：http.get → call_http_get_ */
    @Override
    public String getNamePrefix() {
        return "call_" + call.replaceAll("[^a-zA-Z0-9]", "_") + "_";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitCall(this, context);
    }
}
