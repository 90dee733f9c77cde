package com.stepflow.ir.step;

import com.stepflow.compiler.ast.decl.Parameter;
import com.stepflow.compiler.ast.expr.Expressions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 子工作流：一个函数降级后的参数表与步骤序列
 */
public class Subworkflow {
    private final String name;
    private final List<Parameter> params;
    private final List<WorkflowStep> steps;

    public Subworkflow(String name, List<Parameter> params, List<WorkflowStep> steps) {
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    /**
     * {params?: [name | {name: default}], steps: [{name: body}]}
     */
    public Map<String, Object> render() {
        Map<String, Object> result = new LinkedHashMap<>();
        if (!params.isEmpty()) {
            List<Object> rendered = new ArrayList<>();
            for (Parameter p : params) {
                if (p.hasDefaultValue()) {
                    Map<String, Object> withDefault = new LinkedHashMap<>();
                    withDefault.put(p.getName(), Expressions.toOutputValue(p.getDefaultValue()));
                    rendered.add(withDefault);
                } else {
                    rendered.add(p.getName());
                }
            }
            result.put("params", rendered);
        }
        result.put("steps", StepRenderer.INSTANCE.renderSteps(steps));
        return result;
    }
}
