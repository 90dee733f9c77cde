package com.stepflow.ir.lowering;

import com.stepflow.compiler.ast.expr.BinaryExpr;
import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.PrimitiveLiteral;
import com.stepflow.compiler.ast.expr.VariableRef;
import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.compiler.ast.stmt.TryStmt;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.RaiseStep;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.TryStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * try/catch/finally 模拟。运行时只有 try/except，因此：
 * <pre>
 *   condition_N = null, value_N = null
 *   try {                               // 外层：捕获逃出内层的异常
 *       try { body } except { catch }   // return 改写为记录状态并跳到 finalizer
 *   } except as __fin_exc {
 *       condition_N = "raise", value_N = __fin_exc
 *   }
 *   [finalizer] finally 体
 *   switch { condition_N == "return" → return value_N
 *            condition_N == "raise"  → raise value_N }
 * </pre>
 * N 为 try/finally 的嵌套深度。
 */
final class FinallyLowering {

    static final String EXCEPTION_VARIABLE = "__fin_exc";
    static final String RETURN_TAG = "return";
    static final String RAISE_TAG = "raise";

    private final StatementLowering lowering;
    private final String variablePrefix;

    FinallyLowering(StatementLowering lowering, String variablePrefix) {
        this.lowering = lowering;
        this.variablePrefix = variablePrefix;
    }

    String conditionVariable(int depth) {
        return variablePrefix + "condition" + depth;
    }

    String valueVariable(int depth) {
        return variablePrefix + "value" + depth;
    }

    List<WorkflowStep> lower(TryStmt stmt, LoweringContext ctx) {
        int depth = ctx.getFinallyDepth() + 1;
        VariableRef condition = new VariableRef(conditionVariable(depth));
        VariableRef value = new VariableRef(valueVariable(depth));
        JumpTarget finalizer = ctx.newJumpTarget();

        LoweringContext protectedCtx = ctx.enterProtectedRegion(finalizer.getLabel(), depth);
        List<WorkflowStep> trySteps = lowering.lowerBlock(stmt.getBody(), protectedCtx);
        List<WorkflowStep> exceptSteps = stmt.hasCatch()
                ? lowering.lowerBlock(stmt.getCatchBody(), protectedCtx) : null;
        TryStep inner = new TryStep(null, trySteps, stmt.getRetryPolicy(), stmt.getErrorVariable(), exceptSteps);

        AssignStep captureException = new AssignStep(Arrays.asList(
                new Assignment(condition, PrimitiveLiteral.of(RAISE_TAG)),
                new Assignment(value, new VariableRef(EXCEPTION_VARIABLE))));
        TryStep outer = new TryStep(null, Collections.<WorkflowStep>singletonList(inner), null,
                EXCEPTION_VARIABLE, Collections.<WorkflowStep>singletonList(captureException));

        List<WorkflowStep> finalizerSteps = lowering.lowerBlock(stmt.getFinallyBody(), ctx.enterFinalizer(depth));

        List<WorkflowStep> steps = new ArrayList<>();
        steps.add(new AssignStep(Arrays.asList(
                new Assignment(condition, PrimitiveLiteral.nullLiteral()),
                new Assignment(value, PrimitiveLiteral.nullLiteral()))));
        steps.add(outer);
        steps.add(finalizer);
        steps.addAll(finalizerSteps);
        steps.add(dispatch(condition, value, ctx));
        return steps;
    }

    /**
     * finally 体之后按记录的状态重新 return 或 raise。
     * 外层仍有 finally 时，return 继续交给外层的 finalizer。
     */
    private SwitchStep dispatch(VariableRef condition, VariableRef value, LoweringContext ctx) {
        List<WorkflowStep> onReturn = lowering.lowerBlock(
                Collections.singletonList(lowering.syntheticReturn(value)), ctx);
        List<WorkflowStep> onRaise = Collections.<WorkflowStep>singletonList(new RaiseStep(value));
        return new SwitchStep(Arrays.asList(
                new SwitchBranch(isTag(condition, RETURN_TAG), onReturn, null),
                new SwitchBranch(isTag(condition, RAISE_TAG), onRaise, null)));
    }

    private static Expression isTag(VariableRef condition, String tag) {
        return new BinaryExpr(condition, BinaryExpr.BinaryOp.EQ, PrimitiveLiteral.of(tag));
    }

    /**
     * 保护区内的 return v：记录状态并跳到 finalizer。
     */
    List<WorkflowStep> returnToFinalizer(Expression returnValue, LoweringContext ctx) {
        int depth = ctx.getFinalizerDepth();
        Expression v = returnValue != null ? returnValue : PrimitiveLiteral.nullLiteral();
        List<WorkflowStep> steps = new ArrayList<>();
        steps.add(new AssignStep(Arrays.asList(
                new Assignment(new VariableRef(conditionVariable(depth)), PrimitiveLiteral.of(RETURN_TAG)),
                new Assignment(new VariableRef(valueVariable(depth)), v))));
        steps.add(new NextStep(ctx.getFinalizerTarget()));
        return steps;
    }
}
