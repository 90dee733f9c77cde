package com.stepflow.ir.lowering;

/**
 * break / continue 可以到达的一个结构：循环、switch 或带标签的语句块。
 */
final class JumpScope {

    enum Kind {
        /** for / for-range，break 和 continue 由运行时原生支持 */
        NATIVE_LOOP,
        /** while / do-while，用占位步骤模拟 */
        EMULATED_LOOP,
        SWITCH,
        BLOCK
    }

    private final Kind kind;
    private final String breakTarget;
    private final String continueTarget;   // SWITCH / BLOCK 为 null
    private final String finalizerTarget;  // 进入该结构时所在的 finally 保护区
    private final int forDepth;

    JumpScope(Kind kind, String breakTarget, String continueTarget, String finalizerTarget, int forDepth) {
        this.kind = kind;
        this.breakTarget = breakTarget;
        this.continueTarget = continueTarget;
        this.finalizerTarget = finalizerTarget;
        this.forDepth = forDepth;
    }

    Kind getKind() {
        return kind;
    }

    String getBreakTarget() {
        return breakTarget;
    }

    String getContinueTarget() {
        return continueTarget;
    }

    boolean isLoop() {
        return kind == Kind.NATIVE_LOOP || kind == Kind.EMULATED_LOOP;
    }

    String getFinalizerTarget() {
        return finalizerTarget;
    }

    int getForDepth() {
        return forDepth;
    }
}
