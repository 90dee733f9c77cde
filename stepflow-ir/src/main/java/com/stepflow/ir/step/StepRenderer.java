package com.stepflow.ir.step;

import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.ExpressionRenderer;
import com.stepflow.compiler.ast.expr.Expressions;
import com.stepflow.compiler.ast.stmt.Assignment;
import com.stepflow.compiler.ast.stmt.RetryPolicy;
import com.stepflow.compiler.error.InternalTranspilerException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把已命名的步骤树渲染为纯 Map / List / 标量结构，交给外部序列化器。
 */
public final class StepRenderer implements StepVisitor<Map<String, Object>, Void> {

    public static final StepRenderer INSTANCE = new StepRenderer();

    private StepRenderer() {
    }

    /**
     * 渲染步骤列表为 [{name: body}, ...]。
     */
    public List<Object> renderSteps(List<WorkflowStep> steps) {
        List<Object> result = new ArrayList<>();
        for (WorkflowStep step : steps) {
            if (!step.hasName()) {
                throw new InternalTranspilerException("step without a name: " + step.getNamePrefix());
            }
            Map<String, Object> named = new LinkedHashMap<>();
            named.put(step.getName(), step.accept(this, null));
            result.add(named);
        }
        return result;
    }

    @Override
    public Map<String, Object> visitAssign(AssignStep step, Void context) {
        List<Object> assignments = new ArrayList<>();
        for (Assignment a : step.getAssignments()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(ExpressionRenderer.render(a.getTarget()), Expressions.toOutputValue(a.getValue()));
            assignments.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("assign", assignments);
        if (step.hasNext()) {
            body.put("next", step.getNext());
        }
        return body;
    }

    @Override
    public Map<String, Object> visitCall(CallStep step, Void context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("call", step.getCall());
        if (!step.getArgs().isEmpty()) {
            Map<String, Object> args = new LinkedHashMap<>();
            for (Map.Entry<String, Expression> entry : step.getArgs().entrySet()) {
                args.put(entry.getKey(), Expressions.toOutputValue(entry.getValue()));
            }
            body.put("args", args);
        }
        if (step.getResult() != null) {
            body.put("result", step.getResult());
        }
        return body;
    }

    @Override
    public Map<String, Object> visitFor(ForStep step, Void context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("for", renderForBody(step));
        return body;
    }

    private Map<String, Object> renderForBody(ForStep step) {
        Map<String, Object> loop = new LinkedHashMap<>();
        loop.put("value", step.getLoopVariable());
        if (step.getIndexVariable() != null) {
            loop.put("index", step.getIndexVariable());
        }
        if (step.isRange()) {
            loop.put("range", Arrays.asList(
                    Expressions.toOutputValue(step.getRangeStart()),
                    Expressions.toOutputValue(step.getRangeEnd())));
        } else {
            loop.put("in", Expressions.toOutputValue(step.getIterable()));
        }
        loop.put("steps", renderSteps(step.getSteps()));
        return loop;
    }

    @Override
    public Map<String, Object> visitNext(NextStep step, Void context) {
        return Collections.<String, Object>singletonMap("next", step.getTarget());
    }

    @Override
    public Map<String, Object> visitParallel(ParallelStep step, Void context) {
        Map<String, Object> parallel = new LinkedHashMap<>();
        if (step.getShared() != null) {
            parallel.put("shared", new ArrayList<>(step.getShared()));
        }
        if (step.getConcurrencyLimit() != null) {
            parallel.put("concurrency_limit", step.getConcurrencyLimit().longValue());
        }
        if (step.getExceptionPolicy() != null) {
            parallel.put("exception_policy", step.getExceptionPolicy());
        }
        if (step.isForLoop()) {
            parallel.put("for", renderForBody(step.getForStep()));
        } else {
            List<Object> branches = new ArrayList<>();
            for (ParallelBranch branch : step.getBranches()) {
                Map<String, Object> steps = new LinkedHashMap<>();
                steps.put("steps", renderSteps(branch.getSteps()));
                Map<String, Object> named = new LinkedHashMap<>();
                named.put(branch.getName(), steps);
                branches.add(named);
            }
            parallel.put("branches", branches);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("parallel", parallel);
        return body;
    }

    @Override
    public Map<String, Object> visitRaise(RaiseStep step, Void context) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("raise", Expressions.toOutputValue(step.getValue()));
        return body;
    }

    @Override
    public Map<String, Object> visitReturn(ReturnStep step, Void context) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (step.hasValue()) {
            body.put("return", Expressions.toOutputValue(step.getValue()));
        } else {
            body.put("next", NextStep.END);
        }
        return body;
    }

    @Override
    public Map<String, Object> visitSwitch(SwitchStep step, Void context) {
        List<Object> branches = new ArrayList<>();
        for (SwitchBranch branch : step.getBranches()) {
            Map<String, Object> b = new LinkedHashMap<>();
            b.put("condition", Expressions.toOutputValue(branch.getCondition()));
            if (!branch.getSteps().isEmpty() || !branch.hasNext()) {
                b.put("steps", renderSteps(branch.getSteps()));
            }
            if (branch.hasNext()) {
                b.put("next", branch.getNext());
            }
            branches.add(b);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("switch", branches);
        if (step.hasNext()) {
            body.put("next", step.getNext());
        }
        return body;
    }

    @Override
    public Map<String, Object> visitTry(TryStep step, Void context) {
        Map<String, Object> body = new LinkedHashMap<>();
        Map<String, Object> trySteps = new LinkedHashMap<>();
        trySteps.put("steps", renderSteps(step.getTrySteps()));
        body.put("try", trySteps);
        if (step.getRetryPolicy() != null) {
            body.put("retry", renderRetry(step.getRetryPolicy()));
        }
        if (step.hasExcept()) {
            Map<String, Object> except = new LinkedHashMap<>();
            if (step.getErrorVariable() != null) {
                except.put("as", step.getErrorVariable());
            }
            except.put("steps", renderSteps(step.getExceptSteps()));
            body.put("except", except);
        }
        return body;
    }

    private Object renderRetry(RetryPolicy policy) {
        if (policy instanceof RetryPolicy.Named) {
            return ExpressionRenderer.deferred(((RetryPolicy.Named) policy).getPolicy());
        }
        RetryPolicy.Custom custom = (RetryPolicy.Custom) policy;
        Map<String, Object> retry = new LinkedHashMap<>();
        retry.put("predicate", ExpressionRenderer.deferred(custom.getPredicate()));
        if (custom.getMaxRetries() != null) {
            retry.put("max_retries", Expressions.toOutputValue(custom.getMaxRetries()));
        }
        Map<String, Object> backoff = new LinkedHashMap<>();
        if (custom.getInitialDelay() != null) {
            backoff.put("initial_delay", Expressions.toOutputValue(custom.getInitialDelay()));
        }
        if (custom.getMaxDelay() != null) {
            backoff.put("max_delay", Expressions.toOutputValue(custom.getMaxDelay()));
        }
        if (custom.getMultiplier() != null) {
            backoff.put("multiplier", Expressions.toOutputValue(custom.getMultiplier()));
        }
        retry.put("backoff", backoff);
        return retry;
    }

    @Override
    public Map<String, Object> visitJumpTarget(JumpTarget step, Void context) {
        throw new InternalTranspilerException("unresolved jump target " + step.getLabel());
    }
}
