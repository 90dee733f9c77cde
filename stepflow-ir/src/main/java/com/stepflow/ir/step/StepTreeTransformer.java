package com.stepflow.ir.step;

import java.util.ArrayList;
import java.util.List;

/**
 * 步骤树变换基类：默认原样重建，子类覆写 transformStep 插入处理。
 */
public abstract class StepTreeTransformer {

    public List<WorkflowStep> transformSteps(List<WorkflowStep> steps) {
        List<WorkflowStep> result = new ArrayList<>(steps.size());
        for (WorkflowStep step : steps) {
            result.add(transformStep(step));
        }
        return result;
    }

    protected WorkflowStep transformStep(WorkflowStep step) {
        return transformChildren(step);
    }

    /**
     * 对容器步骤的嵌套步骤列表递归变换。
     */
    protected WorkflowStep transformChildren(WorkflowStep step) {
        if (step instanceof SwitchStep) {
            SwitchStep sw = (SwitchStep) step;
            List<SwitchBranch> branches = new ArrayList<>();
            for (SwitchBranch branch : sw.getBranches()) {
                branches.add(branch.withSteps(transformSteps(branch.getSteps())));
            }
            return sw.withBranches(branches);
        }
        if (step instanceof TryStep) {
            TryStep t = (TryStep) step;
            List<WorkflowStep> trySteps = transformSteps(t.getTrySteps());
            List<WorkflowStep> exceptSteps = t.hasExcept() ? transformSteps(t.getExceptSteps()) : null;
            return t.withSteps(trySteps, exceptSteps);
        }
        if (step instanceof ForStep) {
            ForStep f = (ForStep) step;
            return f.withSteps(transformSteps(f.getSteps()));
        }
        if (step instanceof ParallelStep) {
            ParallelStep p = (ParallelStep) step;
            if (p.isForLoop()) {
                ForStep f = p.getForStep();
                return p.withBody(null, f.withSteps(transformSteps(f.getSteps())));
            }
            List<ParallelBranch> branches = new ArrayList<>();
            for (ParallelBranch branch : p.getBranches()) {
                branches.add(branch.withSteps(transformSteps(branch.getSteps())));
            }
            return p.withBody(branches, null);
        }
        return step;
    }
}
