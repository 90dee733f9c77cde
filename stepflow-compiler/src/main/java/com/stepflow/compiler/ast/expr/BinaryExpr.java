package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public BinaryExpr(Expression left, BinaryOp operator, Expression right) {
        this(null, left, operator, right);
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    /**
     * 二元运算符（目标表达式语言的写法与优先级）
     */
    public enum BinaryOp {
        // 乘除
        MUL("*", 5),
        DIV("/", 5),
        INT_DIV("//", 5),
        MOD("%", 5),

        // 加减
        ADD("+", 4),
        SUB("-", 4),

        // 比较
        EQ("==", 3),
        NE("!=", 3),
        LT("<", 3),
        LE("<=", 3),
        GT(">", 3),
        GE(">=", 3),
        IN("in", 3),

        // 逻辑
        AND("and", 2),
        OR("or", 1);

        private final String symbol;
        private final int precedence;

        BinaryOp(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String getSymbol() {
            return symbol;
        }

        public int getPrecedence() {
            return precedence;
        }

        /**
         * 从源语言运算符解析，=== / !== / && / || 归一化为目标写法。
         */
        public static BinaryOp fromSource(String source) {
            switch (source) {
                case "===": return EQ;
                case "!==": return NE;
                case "&&": return AND;
                case "||": return OR;
                default:
                    for (BinaryOp op : values()) {
                        if (op.symbol.equals(source)) return op;
                    }
                    throw new IllegalArgumentException("Unsupported binary operator: " + source);
            }
        }
    }
}
