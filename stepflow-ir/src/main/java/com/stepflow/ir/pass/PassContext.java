package com.stepflow.ir.pass;

import com.stepflow.ir.metadata.BlockingFunctions;

/**
 * Pass 运行参数。
 */
public final class PassContext {
    private final String tempPrefix;
    private final int maxAssignmentsPerStep;
    private final BlockingFunctions blockingFunctions;

    public PassContext(String tempPrefix, int maxAssignmentsPerStep, BlockingFunctions blockingFunctions) {
        this.tempPrefix = tempPrefix;
        this.maxAssignmentsPerStep = maxAssignmentsPerStep;
        this.blockingFunctions = blockingFunctions;
    }

    /** 临时变量名前缀，如 __temp 或并行区域内的 __temp_parallel1_ */
    public String getTempPrefix() {
        return tempPrefix;
    }

    public int getMaxAssignmentsPerStep() {
        return maxAssignmentsPerStep;
    }

    public BlockingFunctions getBlockingFunctions() {
        return blockingFunctions;
    }

    public PassContext withTempPrefix(String prefix) {
        return new PassContext(prefix, maxAssignmentsPerStep, blockingFunctions);
    }
}
