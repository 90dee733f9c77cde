package com.stepflow.ir;

/**
 * 转译选项。
 */
public class TranspilerOptions {

    /** 设置为 1 时在 stderr 打印降级后的步骤树 */
    public static final String DUMP_STEPS_ENV = "STEPFLOW_DUMP_STEPS";

    private int maxAssignmentsPerStep = 50;
    private boolean dumpSteps = false;
    private String tempVariablePrefix = "__temp";
    private String finallyVariablePrefix = "__finally_";

    public static TranspilerOptions defaults() {
        return new TranspilerOptions();
    }

    /**
     * 默认选项，dump 开关读取环境变量。
     */
    public static TranspilerOptions fromEnvironment() {
        TranspilerOptions options = new TranspilerOptions();
        options.setDumpSteps("1".equals(System.getenv(DUMP_STEPS_ENV)));
        return options;
    }

    public int getMaxAssignmentsPerStep() {
        return maxAssignmentsPerStep;
    }

    public void setMaxAssignmentsPerStep(int maxAssignmentsPerStep) {
        if (maxAssignmentsPerStep < 1) {
            throw new IllegalArgumentException("maxAssignmentsPerStep must be positive: " + maxAssignmentsPerStep);
        }
        this.maxAssignmentsPerStep = maxAssignmentsPerStep;
    }

    public boolean isDumpSteps() {
        return dumpSteps;
    }

    public void setDumpSteps(boolean dumpSteps) {
        this.dumpSteps = dumpSteps;
    }

    public String getTempVariablePrefix() {
        return tempVariablePrefix;
    }

    public void setTempVariablePrefix(String tempVariablePrefix) {
        this.tempVariablePrefix = tempVariablePrefix;
    }

    public String getFinallyVariablePrefix() {
        return finallyVariablePrefix;
    }

    public void setFinallyVariablePrefix(String finallyVariablePrefix) {
        this.finallyVariablePrefix = finallyVariablePrefix;
    }
}
