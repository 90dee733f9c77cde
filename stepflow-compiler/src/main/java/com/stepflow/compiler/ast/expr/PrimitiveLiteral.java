package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * 基本字面量：null / boolean / number / string
 */
public class PrimitiveLiteral extends Expression {

    public enum Kind { NULL, BOOLEAN, NUMBER, STRING }

    private final Kind kind;
    private final Object value;

    public PrimitiveLiteral(SourceLocation location, Object value) {
        super(location);
        this.value = normalize(value);
        this.kind = kindOf(this.value);
    }

    public static PrimitiveLiteral of(Object value) {
        return new PrimitiveLiteral(null, value);
    }

    public static PrimitiveLiteral nullLiteral() {
        return new PrimitiveLiteral(null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** null、Boolean、Long、Double 或 String */
    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isTrue() {
        return kind == Kind.BOOLEAN && (Boolean) value;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    // 整数值统一为 Long，其余数值为 Double
    private static Object normalize(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float || value instanceof Double) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d)
                    && Math.abs(d) < 9.007199254740992E15) {
                return (long) d;
            }
            return d;
        }
        if (value == null || value instanceof Boolean || value instanceof Long
                || value instanceof String) {
            return value;
        }
        throw new IllegalArgumentException("Unsupported primitive value: " + value.getClass().getName());
    }

    private static Kind kindOf(Object value) {
        if (value == null) return Kind.NULL;
        if (value instanceof Boolean) return Kind.BOOLEAN;
        if (value instanceof String) return Kind.STRING;
        return Kind.NUMBER;
    }
}
