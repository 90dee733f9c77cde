package com.stepflow.ir.lowering;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.Expressions;
import com.stepflow.compiler.ast.expr.FunctionInvocationExpr;
import com.stepflow.compiler.ast.expr.MapExpr;
import com.stepflow.compiler.ast.expr.PrimitiveLiteral;
import com.stepflow.compiler.ast.stmt.AssignStmt;
import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.compiler.ast.stmt.BreakStmt;
import com.stepflow.compiler.ast.stmt.ConditionalBranch;
import com.stepflow.compiler.ast.stmt.ContinueStmt;
import com.stepflow.compiler.ast.stmt.DoWhileStmt;
import com.stepflow.compiler.ast.stmt.ForInStmt;
import com.stepflow.compiler.ast.stmt.ForRangeStmt;
import com.stepflow.compiler.ast.stmt.ForStmt;
import com.stepflow.compiler.ast.stmt.FunctionInvocationStmt;
import com.stepflow.compiler.ast.stmt.IfStmt;
import com.stepflow.compiler.ast.stmt.LabelledStmt;
import com.stepflow.compiler.ast.stmt.ParallelStmt;
import com.stepflow.compiler.ast.stmt.RaiseStmt;
import com.stepflow.compiler.ast.stmt.ReturnStmt;
import com.stepflow.compiler.ast.stmt.Statement;
import com.stepflow.compiler.ast.stmt.StmtVisitor;
import com.stepflow.compiler.ast.stmt.SwitchStmt;
import com.stepflow.compiler.ast.stmt.TryStmt;
import com.stepflow.compiler.ast.stmt.WhileStmt;
import com.stepflow.compiler.error.WorkflowSyntaxException;
import com.stepflow.ir.pass.StepPassPipeline;
import com.stepflow.ir.pass.stmt.RetryPolicyFolding;
import com.stepflow.ir.step.AssignStep;
import com.stepflow.ir.step.CallStep;
import com.stepflow.ir.step.ForStep;
import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.NextStep;
import com.stepflow.ir.step.ParallelBranch;
import com.stepflow.ir.step.ParallelStep;
import com.stepflow.ir.step.RaiseStep;
import com.stepflow.ir.step.ReturnStep;
import com.stepflow.ir.step.SwitchBranch;
import com.stepflow.ir.step.SwitchStep;
import com.stepflow.ir.step.TryStep;
import com.stepflow.ir.step.WorkflowStep;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 语句树 → 步骤树降级。
 * 每个语句块降级后立即在该层执行单层改写管线；命名与跳转解析在整棵树完成后进行。
 */
public class StatementLowering implements StmtVisitor<List<WorkflowStep>, LoweringContext> {

    private static final Logger LOG = Logger.getLogger(StatementLowering.class.getName());

    /** 只能作为独立语句出现的内建函数 */
    public static final Set<String> STATEMENT_ONLY_FUNCTIONS = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("parallel", RetryPolicyFolding.RETRY_POLICY, "call_step")));

    private static final Pattern QUALIFIED_NAME = Pattern.compile(
            "[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*");

    private final StepPassPipeline pipeline;
    private final String tempPrefix;
    private final LoopLowering loops;
    private final FinallyLowering finallyLowering;

    public StatementLowering(StepPassPipeline pipeline, String tempPrefix, String finallyVariablePrefix) {
        this.pipeline = pipeline;
        this.tempPrefix = tempPrefix;
        this.loops = new LoopLowering(this);
        this.finallyLowering = new FinallyLowering(this, finallyVariablePrefix);
    }

    /**
     * 降级一个语句块并执行单层改写。
     */
    public List<WorkflowStep> lowerBlock(List<Statement> stmts, LoweringContext ctx) {
        return lowerBlock(stmts, ctx, Collections.<WorkflowStep>emptyList());
    }

    /**
     * trailing 在改写前追加到块尾，便于与最后一个 assign 合并。
     */
    public List<WorkflowStep> lowerBlock(List<Statement> stmts, LoweringContext ctx, List<WorkflowStep> trailing) {
        List<WorkflowStep> steps = new ArrayList<>();
        for (Statement stmt : stmts) {
            steps.addAll(stmt.accept(this, ctx));
        }
        steps.addAll(trailing);
        return pipeline.run(steps, ctx.getPassContext());
    }

    /**
     * 表达式位置不允许出现 parallel / retry_policy / call_step。
     */
    void checkExpression(Expression expr, SourceLocation location) {
        if (expr == null) return;
        FunctionInvocationExpr misplaced = Expressions.findInvocation(expr, STATEMENT_ONLY_FUNCTIONS);
        if (misplaced != null) {
            SourceLocation loc = misplaced.getLocation() != SourceLocation.UNKNOWN ? misplaced.getLocation() : location;
            throw new WorkflowSyntaxException("\"" + misplaced.getFunctionName()
                    + "\" can't be called as part of an expression", loc);
        }
    }

    static boolean isAlwaysTrue(Expression condition) {
        return condition instanceof PrimitiveLiteral && ((PrimitiveLiteral) condition).isTrue();
    }

    ReturnStmt syntheticReturn(Expression value) {
        return new ReturnStmt(null, value);
    }

    @Override
    public List<WorkflowStep> visitAssign(AssignStmt stmt, LoweringContext ctx) {
        for (Assignment a : stmt.getAssignments()) {
            if (!Expressions.isFullyQualifiedName(a.getTarget())) {
                throw new WorkflowSyntaxException(
                        "The left-hand side of an assignment must be an identifier or a property access",
                        stmt.getLocation());
            }
            checkExpression(a.getTarget(), stmt.getLocation());
            checkExpression(a.getValue(), stmt.getLocation());
        }
        return Collections.<WorkflowStep>singletonList(new AssignStep(stmt.getAssignments()));
    }

    @Override
    public List<WorkflowStep> visitIf(IfStmt stmt, LoweringContext ctx) {
        List<SwitchBranch> branches = new ArrayList<>();
        for (ConditionalBranch b : stmt.getBranches()) {
            checkExpression(b.getCondition(), stmt.getLocation());
            branches.add(new SwitchBranch(b.getCondition(), lowerBlock(b.getBody(), ctx), null));
        }
        return Collections.<WorkflowStep>singletonList(new SwitchStep(branches));
    }

    @Override
    public List<WorkflowStep> visitSwitch(SwitchStmt stmt, LoweringContext ctx) {
        return loops.lowerSwitch(stmt, ctx);
    }

    @Override
    public List<WorkflowStep> visitFor(ForStmt stmt, LoweringContext ctx) {
        Expression iterable = stmt.getIterable();
        if (iterable instanceof PrimitiveLiteral || iterable instanceof MapExpr) {
            throw new WorkflowSyntaxException("Must be a list expression", stmt.getLocation());
        }
        checkExpression(iterable, stmt.getLocation());
        List<WorkflowStep> body = lowerBlock(stmt.getBody(), ctx.enterNativeLoop());
        return Collections.<WorkflowStep>singletonList(
                ForStep.overList(stmt.getLoopVariable(), stmt.getIndexVariable(), iterable, body));
    }

    @Override
    public List<WorkflowStep> visitForRange(ForRangeStmt stmt, LoweringContext ctx) {
        for (Expression bound : Arrays.asList(stmt.getRangeStart(), stmt.getRangeEnd())) {
            if (bound instanceof PrimitiveLiteral && !((PrimitiveLiteral) bound).isNumber()) {
                throw new WorkflowSyntaxException("Range bounds must be numbers", stmt.getLocation());
            }
            checkExpression(bound, stmt.getLocation());
        }
        List<WorkflowStep> body = lowerBlock(stmt.getBody(), ctx.enterNativeLoop());
        return Collections.<WorkflowStep>singletonList(
                ForStep.overRange(stmt.getLoopVariable(), stmt.getRangeStart(), stmt.getRangeEnd(), body));
    }

    @Override
    public List<WorkflowStep> visitForIn(ForInStmt stmt, LoweringContext ctx) {
        throw new WorkflowSyntaxException("for...in is not supported. Use for...of instead", stmt.getLocation());
    }

    @Override
    public List<WorkflowStep> visitWhile(WhileStmt stmt, LoweringContext ctx) {
        checkExpression(stmt.getCondition(), stmt.getLocation());
        return loops.lowerWhile(stmt, ctx);
    }

    @Override
    public List<WorkflowStep> visitDoWhile(DoWhileStmt stmt, LoweringContext ctx) {
        checkExpression(stmt.getCondition(), stmt.getLocation());
        return loops.lowerDoWhile(stmt, ctx);
    }

    @Override
    public List<WorkflowStep> visitBreak(BreakStmt stmt, LoweringContext ctx) {
        String target = ctx.resolveBreak(stmt.getLabel(), stmt.getLocation());
        return Collections.<WorkflowStep>singletonList(new NextStep(target));
    }

    @Override
    public List<WorkflowStep> visitContinue(ContinueStmt stmt, LoweringContext ctx) {
        String target = ctx.resolveContinue(stmt.getLabel(), stmt.getLocation());
        return Collections.<WorkflowStep>singletonList(new NextStep(target));
    }

    @Override
    public List<WorkflowStep> visitReturn(ReturnStmt stmt, LoweringContext ctx) {
        checkExpression(stmt.getValue(), stmt.getLocation());
        if (ctx.isInsideFinallyProtectedRegion()) {
            return finallyLowering.returnToFinalizer(stmt.getValue(), ctx);
        }
        return Collections.<WorkflowStep>singletonList(new ReturnStep(stmt.getValue()));
    }

    @Override
    public List<WorkflowStep> visitRaise(RaiseStmt stmt, LoweringContext ctx) {
        checkExpression(stmt.getValue(), stmt.getLocation());
        return Collections.<WorkflowStep>singletonList(new RaiseStep(stmt.getValue()));
    }

    @Override
    public List<WorkflowStep> visitTry(TryStmt stmt, LoweringContext ctx) {
        if (stmt.hasFinally()) {
            return finallyLowering.lower(stmt, ctx);
        }
        List<WorkflowStep> trySteps = lowerBlock(stmt.getBody(), ctx);
        List<WorkflowStep> exceptSteps = stmt.hasCatch() ? lowerBlock(stmt.getCatchBody(), ctx) : null;
        return Collections.<WorkflowStep>singletonList(new TryStep(null, trySteps, stmt.getRetryPolicy(),
                stmt.getErrorVariable(), exceptSteps));
    }

    @Override
    public List<WorkflowStep> visitLabelled(LabelledStmt stmt, LoweringContext ctx) {
        ctx.claimLabel(stmt.getLabel(), stmt.getLocation());
        List<WorkflowStep> steps;
        Statement loop = stmt.getLabelledLoop();
        if (loop != null) {
            steps = new ArrayList<>(loop.accept(this, ctx.withPendingLoopLabel(stmt.getLabel())));
        } else {
            JumpTarget end = ctx.newJumpTarget();
            steps = new ArrayList<>(lowerBlock(stmt.getBody(),
                    ctx.enterLabelledBlock(stmt.getLabel(), end.getLabel())));
            steps.add(end);
        }
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (step instanceof JumpTarget) continue;
            if (!step.hasName()) {
                steps.set(i, step.withName(stmt.getLabel()));
            }
            break;
        }
        return steps;
    }

    @Override
    public List<WorkflowStep> visitParallel(ParallelStmt stmt, LoweringContext ctx) {
        if (stmt.getConcurrencyLimit() != null && stmt.getConcurrencyLimit() <= 0) {
            throw new WorkflowSyntaxException("concurrency_limit must be a positive integer", stmt.getLocation());
        }
        LoweringContext branchCtx = ctx.enterParallel(tempPrefix);
        if (stmt.isForLoop()) {
            ForStep loop = (ForStep) stmt.getForLoop().accept(this, branchCtx).get(0);
            return Collections.<WorkflowStep>singletonList(new ParallelStep(null, null, loop,
                    stmt.getShared(), stmt.getConcurrencyLimit(), stmt.getExceptionPolicy()));
        }
        List<ParallelBranch> branches = new ArrayList<>();
        for (int i = 0; i < stmt.getBranches().size(); i++) {
            branches.add(new ParallelBranch("branch" + (i + 1), lowerBlock(stmt.getBranches().get(i), branchCtx)));
        }
        return Collections.<WorkflowStep>singletonList(new ParallelStep(null, branches, null,
                stmt.getShared(), stmt.getConcurrencyLimit(), stmt.getExceptionPolicy()));
    }

    @Override
    public List<WorkflowStep> visitInvocation(FunctionInvocationStmt stmt, LoweringContext ctx) {
        if (RetryPolicyFolding.isRetryPolicyCall(stmt)) {
            LOG.warning("retry_policy at " + stmt.getLocation() + " is not attached to a try statement and is ignored");
            return Collections.emptyList();
        }
        if (!QUALIFIED_NAME.matcher(stmt.getCallee()).matches()) {
            throw new WorkflowSyntaxException("Callee must be a qualified function name: " + stmt.getCallee(),
                    stmt.getLocation());
        }
        for (Expression arg : stmt.getArguments().values()) {
            checkExpression(arg, stmt.getLocation());
        }
        return Collections.<WorkflowStep>singletonList(
                new CallStep(null, stmt.getCallee(), stmt.getArguments(), stmt.getResultVariable()));
    }
}
