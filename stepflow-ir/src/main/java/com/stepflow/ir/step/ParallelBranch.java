package com.stepflow.ir.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 并行步骤的一个分支（branch1, branch2, ...）
 */
public final class ParallelBranch {
    private final String name;
    private final List<WorkflowStep> steps;

    public ParallelBranch(String name, List<WorkflowStep> steps) {
        this.name = name;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public String getName() {
        return name;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public ParallelBranch withSteps(List<WorkflowStep> newSteps) {
        return new ParallelBranch(name, newSteps);
    }
}
