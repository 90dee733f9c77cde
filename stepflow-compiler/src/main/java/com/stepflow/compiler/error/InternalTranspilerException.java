package com.stepflow.compiler.error;

/**
 * 编译器内部不变量被破坏（实现缺陷，不是用户错误）
 */
public class InternalTranspilerException extends RuntimeException {

    public static final String PREFIX = "Internal error: ";

    public InternalTranspilerException(String message) {
        super(PREFIX + message);
    }
}
