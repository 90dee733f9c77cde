package com.stepflow.ir.step;

/**
 * 步骤访问者
 */
public interface StepVisitor<R, C> {

    R visitAssign(AssignStep step, C context);

    R visitCall(CallStep step, C context);

    R visitFor(ForStep step, C context);

    R visitNext(NextStep step, C context);

    R visitParallel(ParallelStep step, C context);

    R visitRaise(RaiseStep step, C context);

    R visitReturn(ReturnStep step, C context);

    R visitSwitch(SwitchStep step, C context);

    R visitTry(TryStep step, C context);

    R visitJumpTarget(JumpTarget step, C context);
}
