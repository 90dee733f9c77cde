package com.stepflow.ir.lowering;

import com.stepflow.compiler.error.InternalTranspilerException;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.ForStep;
import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.ParallelBranch;
import com.stepflow.ir.step.ParallelStep;
import com.stepflow.ir.step.StepTreeTransformer;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.TryStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 跳转占位解析，在命名完成后对整棵步骤树执行一次：
 * 1. 每个占位标签映射到其后第一个实际步骤的名字，没有则映射到所在列表的隐式后继；
 * 2. 改写所有 next 引用并删除占位步骤。
 * 隐式后继：顶层为 end，for 体为 continue，并行分支为 end，switch 分支与 try/except 为父步骤的后继。
 */
public final class JumpTargetResolver {

    public List<WorkflowStep> resolve(List<WorkflowStep> steps) {
        Map<String, String> targets = new HashMap<>();
        collect(steps, NextStep.END, targets);
        List<WorkflowStep> resolved = new Rewriter(targets).transformSteps(steps);
        new Verifier().transformSteps(resolved);
        return resolved;
    }

    private void collect(List<WorkflowStep> steps, String successor, Map<String, String> targets) {
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String follower = followerOf(steps, i + 1, successor);
            if (step instanceof JumpTarget) {
                targets.put(((JumpTarget) step).getLabel(), follower);
            } else if (step instanceof SwitchStep) {
                for (SwitchBranch branch : ((SwitchStep) step).getBranches()) {
                    collect(branch.getSteps(), follower, targets);
                }
            } else if (step instanceof TryStep) {
                TryStep t = (TryStep) step;
                collect(t.getTrySteps(), follower, targets);
                if (t.hasExcept()) {
                    collect(t.getExceptSteps(), follower, targets);
                }
            } else if (step instanceof ForStep) {
                collect(((ForStep) step).getSteps(), NextStep.CONTINUE, targets);
            } else if (step instanceof ParallelStep) {
                ParallelStep p = (ParallelStep) step;
                if (p.isForLoop()) {
                    collect(p.getForStep().getSteps(), NextStep.CONTINUE, targets);
                } else {
                    for (ParallelBranch branch : p.getBranches()) {
                        collect(branch.getSteps(), NextStep.END, targets);
                    }
                }
            }
        }
    }

    private static String followerOf(List<WorkflowStep> steps, int from, String successor) {
        for (int i = from; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (step instanceof JumpTarget) continue;
            if (!step.hasName()) {
                throw new InternalTranspilerException("jump target resolution before naming");
            }
            return step.getName();
        }
        return successor;
    }

    /** 改写 next 引用并删除占位步骤 */
    private static final class Rewriter extends StepTreeTransformer {
        private final Map<String, String> targets;

        Rewriter(Map<String, String> targets) {
            this.targets = targets;
        }

        private String map(String target) {
            if (target == null) return null;
            String resolved = targets.get(target);
            return resolved != null ? resolved : target;
        }

        @Override
        public List<WorkflowStep> transformSteps(List<WorkflowStep> steps) {
            List<WorkflowStep> result = new ArrayList<>();
            for (WorkflowStep step : steps) {
                if (!(step instanceof JumpTarget)) {
                    result.add(transformStep(step));
                }
            }
            return result;
        }

        @Override
        protected WorkflowStep transformStep(WorkflowStep step) {
            WorkflowStep s = step;
            if (s instanceof NextStep) {
                s = ((NextStep) s).withTarget(map(((NextStep) s).getTarget()));
            } else if (s instanceof AssignStep && ((AssignStep) s).hasNext()) {
                s = ((AssignStep) s).withNext(map(((AssignStep) s).getNext()));
            } else if (s instanceof SwitchStep) {
                SwitchStep sw = (SwitchStep) s;
                List<SwitchBranch> branches = new ArrayList<>();
                for (SwitchBranch branch : sw.getBranches()) {
                    branches.add(branch.hasNext() ? branch.withNext(map(branch.getNext())) : branch);
                }
                s = sw.withBranches(branches).withNext(map(sw.getNext()));
            }
            return transformChildren(s);
        }
    }

    /** 解析后不允许残留对占位标签的引用 */
    private static final class Verifier extends StepTreeTransformer {

        private static void check(String target) {
            if (JumpTarget.isPlaceholderLabel(target)) {
                throw new InternalTranspilerException("unresolved jump target " + target);
            }
        }

        @Override
        protected WorkflowStep transformStep(WorkflowStep step) {
            if (step instanceof JumpTarget) {
                throw new InternalTranspilerException("jump target " + ((JumpTarget) step).getLabel()
                        + " left in the step tree");
            }
            if (step instanceof NextStep) {
                check(((NextStep) step).getTarget());
            } else if (step instanceof AssignStep) {
                check(((AssignStep) step).getNext());
            } else if (step instanceof SwitchStep) {
                check(((SwitchStep) step).getNext());
                for (SwitchBranch branch : ((SwitchStep) step).getBranches()) {
                    check(branch.getNext());
                }
            }
            return transformChildren(step);
        }
    }
}
