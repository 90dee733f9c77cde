package com.stepflow.ir.pass.step;

import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.pass.StepPass;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 跳转折叠：
 * - 紧跟在无 next 的 assign 后的无名 next 步骤并入 assign.next
 * - 只含一个 next 步骤的 switch 分支改写为分支上的 next
 */
public class NextFlattening implements StepPass {

    @Override
    public String getName() {
        return "NextFlattening";
    }

    @Override
    public List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context) {
        List<WorkflowStep> result = new ArrayList<>();
        for (WorkflowStep current : steps) {
            WorkflowStep prev = result.isEmpty() ? null : result.get(result.size() - 1);
            if (current instanceof NextStep && !current.hasName()
                    && prev instanceof AssignStep && !((AssignStep) prev).hasNext()) {
                result.set(result.size() - 1, ((AssignStep) prev).withNext(((NextStep) current).getTarget()));
                continue;
            }
            if (current instanceof SwitchStep) {
                current = flattenBranches((SwitchStep) current);
            }
            result.add(current);
        }
        return result;
    }

    private SwitchStep flattenBranches(SwitchStep step) {
        List<SwitchBranch> branches = new ArrayList<>();
        boolean changed = false;
        for (SwitchBranch branch : step.getBranches()) {
            if (!branch.hasNext() && branch.getSteps().size() == 1
                    && branch.getSteps().get(0) instanceof NextStep
                    && !branch.getSteps().get(0).hasName()) {
                NextStep jump = (NextStep) branch.getSteps().get(0);
                branches.add(branch.withSteps(Collections.<WorkflowStep>emptyList()).withNext(jump.getTarget()));
                changed = true;
            } else {
                branches.add(branch);
            }
        }
        return changed ? step.withBranches(branches) : step;
    }
}
