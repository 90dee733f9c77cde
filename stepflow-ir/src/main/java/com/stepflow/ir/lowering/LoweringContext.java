package com.stepflow.ir.lowering;

import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.error.InternalTranspilerException;
import com.stepflow.compiler.error.WorkflowSyntaxException;
import com.stepflow.ir.pass.PassContext;
import com.stepflow.ir.step.JumpTarget;
import com.stepflow.ir.step.NextStep;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 语句 → 步骤降级上下文。
 * 每层嵌套派生一个新实例，记录 break / continue / 标签的去向与 finally 保护区；
 * 占位标签计数器和已用标签在同一子工作流内共享。
 */
public final class LoweringContext {

    /** 一个子工作流内共享的可变状态 */
    private static final class SubworkflowState {
        private int jumpTargetCounter = 0;
        private final Set<String> labels = new LinkedHashSet<>();
    }

    private final SubworkflowState state;
    private final PassContext passContext;
    private final JumpScope breakScope;
    private final JumpScope continueScope;
    private final Map<String, JumpScope> labels;
    private final String pendingLoopLabel;
    private final String finalizerTarget;
    private final int finalizerDepth;
    private final int finallyDepth;
    private final int forDepth;
    private final int parallelDepth;

    private LoweringContext(SubworkflowState state, PassContext passContext,
                            JumpScope breakScope, JumpScope continueScope, Map<String, JumpScope> labels,
                            String pendingLoopLabel, String finalizerTarget, int finalizerDepth,
                            int finallyDepth, int forDepth, int parallelDepth) {
        this.state = state;
        this.passContext = passContext;
        this.breakScope = breakScope;
        this.continueScope = continueScope;
        this.labels = labels;
        this.pendingLoopLabel = pendingLoopLabel;
        this.finalizerTarget = finalizerTarget;
        this.finalizerDepth = finalizerDepth;
        this.finallyDepth = finallyDepth;
        this.forDepth = forDepth;
        this.parallelDepth = parallelDepth;
    }

    /**
     * 子工作流顶层上下文。
     */
    public static LoweringContext root(PassContext passContext) {
        return new LoweringContext(new SubworkflowState(), passContext, null, null,
                Collections.<String, JumpScope>emptyMap(), null, null, 0, 0, 0, 0);
    }

    private LoweringContext copy(JumpScope breakScope, JumpScope continueScope, Map<String, JumpScope> labels,
                                 String finalizerTarget, int finalizerDepth, int finallyDepth, int forDepth) {
        return new LoweringContext(state, passContext, breakScope, continueScope, labels,
                null, finalizerTarget, finalizerDepth, finallyDepth, forDepth, parallelDepth);
    }

    public PassContext getPassContext() {
        return passContext;
    }

    public String getFinalizerTarget() {
        return finalizerTarget;
    }

    /** 当前 finalizer 所属 try/finally 的嵌套深度 */
    public int getFinalizerDepth() {
        return finalizerDepth;
    }

    public boolean isInsideFinallyProtectedRegion() {
        return finalizerTarget != null;
    }

    public int getFinallyDepth() {
        return finallyDepth;
    }

    public int getParallelDepth() {
        return parallelDepth;
    }

    /** 所有用户标签，命名时不会再生成这些名字 */
    public Set<String> getUserLabels() {
        return Collections.unmodifiableSet(state.labels);
    }

    /**
     * 新建跳转占位步骤，标签在子工作流内唯一。
     */
    public JumpTarget newJumpTarget() {
        state.jumpTargetCounter++;
        return new JumpTarget(JumpTarget.LABEL_PREFIX + state.jumpTargetCounter);
    }

    // ============ 作用域派生 ============

    /**
     * 记录一个用户标签，重复或与保留字冲突时报错。
     */
    public void claimLabel(String label, SourceLocation location) {
        if (NextStep.isReserved(label)) {
            throw new WorkflowSyntaxException("Label \"" + label + "\" is a reserved word", location);
        }
        if (!state.labels.add(label)) {
            throw new WorkflowSyntaxException("Duplicate label \"" + label + "\"", location);
        }
    }

    /** 标签直接修饰的循环在进入时登记该标签 */
    public LoweringContext withPendingLoopLabel(String label) {
        return new LoweringContext(state, passContext, breakScope, continueScope, labels,
                label, finalizerTarget, finalizerDepth, finallyDepth, forDepth, parallelDepth);
    }

    public LoweringContext enterNativeLoop() {
        JumpScope scope = new JumpScope(JumpScope.Kind.NATIVE_LOOP, NextStep.BREAK, NextStep.CONTINUE,
                finalizerTarget, forDepth + 1);
        return copy(scope, scope, withLabel(scope), finalizerTarget, finalizerDepth, finallyDepth, forDepth + 1);
    }

    public LoweringContext enterEmulatedLoop(String breakLabel, String continueLabel) {
        JumpScope scope = new JumpScope(JumpScope.Kind.EMULATED_LOOP, breakLabel, continueLabel,
                finalizerTarget, forDepth);
        return copy(scope, scope, withLabel(scope), finalizerTarget, finalizerDepth, finallyDepth, forDepth);
    }

    public LoweringContext enterSwitch(String endLabel) {
        JumpScope scope = new JumpScope(JumpScope.Kind.SWITCH, endLabel, null, finalizerTarget, forDepth);
        return copy(scope, continueScope, labels, finalizerTarget, finalizerDepth, finallyDepth, forDepth);
    }

    public LoweringContext enterLabelledBlock(String label, String endLabel) {
        JumpScope scope = new JumpScope(JumpScope.Kind.BLOCK, endLabel, null, finalizerTarget, forDepth);
        Map<String, JumpScope> extended = new HashMap<>(labels);
        extended.put(label, scope);
        return copy(breakScope, continueScope, extended, finalizerTarget, finalizerDepth, finallyDepth, forDepth);
    }

    /**
     * try/finally 的 try 体与 catch 体：return 改写为跳到 finalizerLabel。
     */
    public LoweringContext enterProtectedRegion(String finalizerLabel, int depth) {
        return copy(breakScope, continueScope, labels, finalizerLabel, depth, depth, forDepth);
    }

    /**
     * finally 体：沿用外层的 return 去向，只占用新的嵌套深度。
     */
    public LoweringContext enterFinalizer(int depth) {
        return copy(breakScope, continueScope, labels, finalizerTarget, finalizerDepth, depth, forDepth);
    }

    /**
     * 并行分支：外层的跳转目标与 finally 保护区都不可见。
     */
    public LoweringContext enterParallel(String baseTempPrefix) {
        int depth = parallelDepth + 1;
        PassContext branchPasses = passContext.withTempPrefix(baseTempPrefix + "_parallel" + depth + "_");
        return new LoweringContext(state, branchPasses, null, null,
                Collections.<String, JumpScope>emptyMap(), null, null, 0, finallyDepth, 0, depth);
    }

    private Map<String, JumpScope> withLabel(JumpScope scope) {
        if (pendingLoopLabel == null) {
            return labels;
        }
        Map<String, JumpScope> extended = new HashMap<>(labels);
        extended.put(pendingLoopLabel, scope);
        return extended;
    }

    // ============ 跳转解析 ============

    public String resolveBreak(String label, SourceLocation location) {
        JumpScope scope = label != null ? lookupLabel(label, location) : breakScope;
        if (scope == null) {
            throw new WorkflowSyntaxException("break must be inside a loop or a switch", location);
        }
        checkReachable(scope, "break", location);
        return scope.getBreakTarget();
    }

    public String resolveContinue(String label, SourceLocation location) {
        JumpScope scope = label != null ? lookupLabel(label, location) : continueScope;
        if (scope == null) {
            throw new WorkflowSyntaxException("continue must be inside a loop", location);
        }
        if (!scope.isLoop()) {
            throw new WorkflowSyntaxException("continue target \"" + label + "\" is not a loop", location);
        }
        checkReachable(scope, "continue", location);
        return scope.getContinueTarget();
    }

    private JumpScope lookupLabel(String label, SourceLocation location) {
        JumpScope scope = labels.get(label);
        if (scope == null) {
            throw new WorkflowSyntaxException("Unknown label \"" + label + "\"", location);
        }
        return scope;
    }

    private void checkReachable(JumpScope scope, String keyword, SourceLocation location) {
        if (!Objects.equals(scope.getFinalizerTarget(), finalizerTarget)) {
            throw new InternalTranspilerException(keyword + " out of a try-finally block is not supported (at "
                    + location + ")");
        }
        if (scope.getForDepth() != forDepth) {
            throw new WorkflowSyntaxException(keyword + " can not jump out of a for loop body", location);
        }
    }
}
