package com.stepflow.ir.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 并行步骤：若干命名分支或一个 for 循环
 */
public class ParallelStep extends WorkflowStep {
    private final List<ParallelBranch> branches;  // 与 forStep 互斥
    private final ForStep forStep;
    private final List<String> shared;            // 可选
    private final Integer concurrencyLimit;       // 可选
    private final String exceptionPolicy;         // 可选

    public ParallelStep(String name, List<ParallelBranch> branches, ForStep forStep,
                        List<String> shared, Integer concurrencyLimit, String exceptionPolicy) {
        super(name);
        this.branches = branches != null ? Collections.unmodifiableList(new ArrayList<>(branches)) : null;
        this.forStep = forStep;
        this.shared = shared;
        this.concurrencyLimit = concurrencyLimit;
        this.exceptionPolicy = exceptionPolicy;
    }

    public List<ParallelBranch> getBranches() {
        return branches;
    }

    public ForStep getForStep() {
        return forStep;
    }

    public boolean isForLoop() {
        return forStep != null;
    }

    public List<String> getShared() {
        return shared;
    }

    public Integer getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public String getExceptionPolicy() {
        return exceptionPolicy;
    }

    public ParallelStep withBody(List<ParallelBranch> newBranches, ForStep newForStep) {
        return new ParallelStep(name, newBranches, newForStep, shared, concurrencyLimit, exceptionPolicy);
    }

    @Override
    public ParallelStep withName(String newName) {
        return new ParallelStep(newName, branches, forStep, shared, concurrencyLimit, exceptionPolicy);
    }

    @Override
    public String getNamePrefix() {
        return "parallel";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitParallel(this, context);
    }
}
