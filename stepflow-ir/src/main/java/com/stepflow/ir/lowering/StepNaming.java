package com.stepflow.ir.lowering;

import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.StepTreeTransformer;
import com.stepflow.ir.step.WorkflowStep;

/**
 * 按前序遍历为尚无名字的步骤生成名字；占位步骤不命名。
 */
public class StepNaming extends StepTreeTransformer {

    private final StepNameGenerator generator;

    public StepNaming(StepNameGenerator generator) {
        this.generator = generator;
    }

    @Override
    protected WorkflowStep transformStep(WorkflowStep step) {
        WorkflowStep named = step;
        if (!(step instanceof JumpTarget) && !step.hasName()) {
            named = step.withName(generator.next(step.getNamePrefix()));
        }
        return transformChildren(named);
    }
}
