package com.stepflow.ir.step;

/**
 * 无条件跳转。目标为步骤名、占位标签或保留字 break / continue / end。
 */
public class NextStep extends WorkflowStep {
    public static final String BREAK = "break";
    public static final String CONTINUE = "continue";
    public static final String END = "end";

    private final String target;

    public NextStep(String name, String target) {
        super(name);
        this.target = target;
    }

    public NextStep(String target) {
        this(null, target);
    }

    public String getTarget() {
        return target;
    }

    public NextStep withTarget(String newTarget) {
        return new NextStep(name, newTarget);
    }

    @Override
    public NextStep withName(String newName) {
        return new NextStep(newName, target);
    }

    @Override
    public String getNamePrefix() {
        return "next";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitNext(this, context);
    }

    public static boolean isReserved(String target) {
        return BREAK.equals(target) || CONTINUE.equals(target) || END.equals(target);
    }
}
