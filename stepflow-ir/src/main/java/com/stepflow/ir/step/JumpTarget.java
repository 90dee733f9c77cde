package com.stepflow.ir.step;

/**
 * 跳转占位步骤。
 * 标记 break / continue 等跳转的落点，跳转解析后被删除，不会出现在输出中。
 */
public class JumpTarget extends WorkflowStep {
    /** 不是合法标识符，不会与用户标签冲突 */
    public static final String LABEL_PREFIX = "jumptarget#";

    private final String label;

    public JumpTarget(String label) {
        super(null);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static boolean isPlaceholderLabel(String target) {
        return target != null && target.startsWith(LABEL_PREFIX);
    }

    @Override
    public JumpTarget withName(String newName) {
        return this;
    }

    @Override
    public String getNamePrefix() {
        return "jumptarget";
    }

    @Override
    public <R, C> R accept(StepVisitor<R, C> visitor, C context) {
        return visitor.visitJumpTarget(this, context);
    }
}
