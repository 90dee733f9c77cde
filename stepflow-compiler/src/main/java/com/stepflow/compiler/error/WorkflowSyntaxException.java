package com.stepflow.compiler.error;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * 用户程序超出受支持子集时抛出的语法/语义错误
 */
public class WorkflowSyntaxException extends RuntimeException {
    private final SourceLocation location;

    public WorkflowSyntaxException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (location != SourceLocation.UNKNOWN) {
            sb.append(" at ").append(location);
        }
        return sb.toString();
    }
}
