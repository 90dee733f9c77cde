package com.stepflow.ir.pass;

import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.Expressions;
import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.CallStep;
import com.stepflow.ir.step.ForStep;
import com.stepflow.ir.step.RaiseStep;
import com.stepflow.ir.step.ReturnStep;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * 访问步骤自身（不含嵌套步骤）的表达式。
 */
public final class StepExpressions {

    private StepExpressions() {
    }

    /**
     * 按求值顺序对步骤自身的每个表达式应用 fn，返回新步骤。
     */
    public static WorkflowStep transform(WorkflowStep step, UnaryOperator<Expression> fn) {
        if (step instanceof AssignStep) {
            AssignStep assign = (AssignStep) step;
            List<Assignment> assignments = new ArrayList<>();
            for (Assignment a : assign.getAssignments()) {
                assignments.add(new Assignment(a.getTarget(), fn.apply(a.getValue())));
            }
            return assign.withAssignments(assignments);
        }
        if (step instanceof CallStep) {
            CallStep call = (CallStep) step;
            Map<String, Expression> args = new LinkedHashMap<>();
            for (Map.Entry<String, Expression> entry : call.getArgs().entrySet()) {
                args.put(entry.getKey(), fn.apply(entry.getValue()));
            }
            return call.withArgs(args);
        }
        if (step instanceof ForStep) {
            ForStep f = (ForStep) step;
            if (f.isRange()) {
                Expression start = fn.apply(f.getRangeStart());
                return f.withRange(start, fn.apply(f.getRangeEnd()));
            }
            return f.withIterable(fn.apply(f.getIterable()));
        }
        if (step instanceof RaiseStep) {
            RaiseStep raise = (RaiseStep) step;
            return raise.withValue(fn.apply(raise.getValue()));
        }
        if (step instanceof ReturnStep) {
            ReturnStep ret = (ReturnStep) step;
            return ret.hasValue() ? ret.withValue(fn.apply(ret.getValue())) : ret;
        }
        if (step instanceof SwitchStep) {
            SwitchStep sw = (SwitchStep) step;
            List<SwitchBranch> branches = new ArrayList<>();
            for (SwitchBranch branch : sw.getBranches()) {
                branches.add(branch.withCondition(fn.apply(branch.getCondition())));
            }
            return sw.withBranches(branches);
        }
        return step;
    }

    /**
     * 步骤自身引用或写入的所有变量名，用于避开临时变量冲突。
     */
    public static Set<String> referencedNames(WorkflowStep step) {
        Set<String> names = new LinkedHashSet<>();
        transform(step, e -> {
            names.addAll(Expressions.referencedNames(e));
            return e;
        });
        if (step instanceof AssignStep) {
            for (Assignment a : ((AssignStep) step).getAssignments()) {
                names.addAll(Expressions.referencedNames(a.getTarget()));
            }
        }
        if (step instanceof CallStep && ((CallStep) step).getResult() != null) {
            names.add(((CallStep) step).getResult());
        }
        return names;
    }
}
