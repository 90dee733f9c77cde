package com.stepflow.ir.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 条件分支步骤
 */
public class SwitchStep extends WorkflowStep {
    private final List<SwitchBranch> branches;
    private final String next;  // 可选，没有分支命中时的去向

    public SwitchStep(String name, List<SwitchBranch> branches, String next) {
        super(name);
        this.branches = Collections.unmodifiableList(new ArrayList<>(branches));
        this.next = next;
    }

    public SwitchStep(List<SwitchBranch> branches) {
        this(null, branches, null);
    }

    public List<SwitchBranch> getBranches() {
        return branches;
    }

    public String getNext() {
        return next;
    }

    public boolean hasNext() {
        return next != null;
    }

    public SwitchStep withBranches(List<SwitchBranch> newBranches) {
        return new SwitchStep(name, newBranches, next);
    }

    public SwitchStep withNext(String newNext) {
        return new SwitchStep(name, branches, newNext);
    }

    @Override
    public SwitchStep withName(String newName) {
        return new SwitchStep(newName, branches, next);
    }

    @Override
    public String getNamePrefix() {
        return "switch";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitSwitch(this, context);
    }
}
