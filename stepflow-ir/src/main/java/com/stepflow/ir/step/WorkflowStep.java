package com.stepflow.ir.step;

/**
 * 工作流步骤基类。
 * 降级阶段 name 只来自用户标签，命名阶段为其余步骤补全名字。
 */
public abstract class WorkflowStep {
    protected final String name;  // 可选

    protected WorkflowStep(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    /** 返回换名后的副本 */
    public abstract WorkflowStep withName(String newName);

    /** 命名时使用的前缀，如 assign、switch */
    public abstract String getNamePrefix();

    public abstract <R, C> R accept(StepVisitor<R, C> visitor, C context);
}
