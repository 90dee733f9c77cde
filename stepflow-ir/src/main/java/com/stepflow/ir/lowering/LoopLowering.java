package com.stepflow.ir.lowering;

import com.stepflow.compiler.ast.stmt.ConditionalBranch;
import com.stepflow.compiler.ast.stmt.DoWhileStmt;
import com.stepflow.compiler.ast.stmt.SwitchStmt;
import com.stepflow.compiler.ast.stmt.WhileStmt;
import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 运行时没有原生支持的控制结构：while、do-while 与可贯穿的 switch 语句，
 * 均改写为 switch 步骤加跳转占位。
 */
final class LoopLowering {

    private final StatementLowering lowering;

    LoopLowering(StatementLowering lowering) {
        this.lowering = lowering;
    }

    /**
     * [start] switch(cond){ body; next: start } [end]
     * continue 跳到 start（条件判断），break 跳到 end。
     */
    List<WorkflowStep> lowerWhile(WhileStmt stmt, LoweringContext ctx) {
        JumpTarget start = ctx.newJumpTarget();
        JumpTarget end = ctx.newJumpTarget();
        LoweringContext bodyCtx = ctx.enterEmulatedLoop(end.getLabel(), start.getLabel());

        List<WorkflowStep> body = lowering.lowerBlock(stmt.getBody(), bodyCtx,
                Collections.<WorkflowStep>singletonList(new NextStep(start.getLabel())));
        SwitchStep loop = new SwitchStep(Collections.singletonList(
                new SwitchBranch(stmt.getCondition(), body, null)));

        List<WorkflowStep> steps = new ArrayList<>();
        steps.add(start);
        steps.add(loop);
        steps.add(end);
        return steps;
    }

    /**
     * [start] body [recheck] switch(cond){ next: start } [end]
     * continue 跳到条件复查处，break 跳到 end。
     */
    List<WorkflowStep> lowerDoWhile(DoWhileStmt stmt, LoweringContext ctx) {
        JumpTarget start = ctx.newJumpTarget();
        JumpTarget recheck = ctx.newJumpTarget();
        JumpTarget end = ctx.newJumpTarget();
        LoweringContext bodyCtx = ctx.enterEmulatedLoop(end.getLabel(), recheck.getLabel());

        List<WorkflowStep> steps = new ArrayList<>();
        steps.add(start);
        steps.addAll(lowering.lowerBlock(stmt.getBody(), bodyCtx));
        steps.add(recheck);
        steps.add(new SwitchStep(Collections.singletonList(
                new SwitchBranch(stmt.getCondition(), Collections.<WorkflowStep>emptyList(), start.getLabel()))));
        steps.add(end);
        return steps;
    }

    /**
     * switch 步骤的每个分支跳到对应 case 体的入口，case 体依次排列以保留贯穿语义。
     * 没有 default 时追加跳到末尾的 next。
     */
    List<WorkflowStep> lowerSwitch(SwitchStmt stmt, LoweringContext ctx) {
        JumpTarget end = ctx.newJumpTarget();
        LoweringContext caseCtx = ctx.enterSwitch(end.getLabel());

        List<SwitchBranch> branches = new ArrayList<>();
        List<WorkflowStep> caseSteps = new ArrayList<>();
        boolean hasDefault = false;
        for (ConditionalBranch c : stmt.getCases()) {
            lowering.checkExpression(c.getCondition(), stmt.getLocation());
            JumpTarget entry = ctx.newJumpTarget();
            branches.add(new SwitchBranch(c.getCondition(), null, entry.getLabel()));
            caseSteps.add(entry);
            caseSteps.addAll(lowering.lowerBlock(c.getBody(), caseCtx));
            hasDefault |= StatementLowering.isAlwaysTrue(c.getCondition());
        }

        List<WorkflowStep> steps = new ArrayList<>();
        steps.add(new SwitchStep(null, branches, hasDefault ? null : end.getLabel()));
        steps.addAll(caseSteps);
        steps.add(end);
        return steps;
    }
}
