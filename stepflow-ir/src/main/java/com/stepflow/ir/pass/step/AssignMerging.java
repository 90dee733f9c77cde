package com.stepflow.ir.pass.step;

import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.pass.StepPass;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.List;

/**
 * 合并相邻的 assign 步骤。
 * 前一个步骤没有 next 且条目数未达上限时才合并；名字取第一个存在的。
 */
public class AssignMerging implements StepPass {

    @Override
    public String getName() {
        return "AssignMerging";
    }

    @Override
    public List<WorkflowStep> run(List<WorkflowStep> steps, PassContext context) {
        List<WorkflowStep> result = new ArrayList<>();
        for (WorkflowStep current : steps) {
            WorkflowStep prev = result.isEmpty() ? null : result.get(result.size() - 1);
            if (current instanceof AssignStep && prev instanceof AssignStep) {
                AssignStep prevAssign = (AssignStep) prev;
                AssignStep currentAssign = (AssignStep) current;
                if (!prevAssign.hasNext()
                        && prevAssign.getAssignments().size() < context.getMaxAssignmentsPerStep()) {
                    List<Assignment> merged = new ArrayList<>(prevAssign.getAssignments());
                    merged.addAll(currentAssign.getAssignments());
                    String name = prevAssign.hasName() ? prevAssign.getName() : currentAssign.getName();
                    result.set(result.size() - 1, new AssignStep(name, merged, currentAssign.getNext()));
                    continue;
                }
            }
            result.add(current);
        }
        return result;
    }
}
