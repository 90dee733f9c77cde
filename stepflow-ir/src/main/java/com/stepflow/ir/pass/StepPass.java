package com.stepflow.ir.pass;

import com.stepflow.ir.step.WorkflowStep;

import java.util.List;

/**
 * 单层步骤列表上的改写 pass。
 * 只处理给定列表中的步骤自身，不递归进入已处理过的嵌套步骤体。
 */
public interface StepPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 改写一层步骤列表。
     */
    List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context);
}
