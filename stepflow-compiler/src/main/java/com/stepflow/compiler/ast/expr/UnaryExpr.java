package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * 一元表达式
 */
public class UnaryExpr extends Expression {
    private final UnaryOp operator;
    private final Expression operand;

    public UnaryExpr(SourceLocation location, UnaryOp operator, Expression operand) {
        super(location);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryExpr(UnaryOp operator, Expression operand) {
        this(null, operator, operand);
    }

    public UnaryOp getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    /**
     * 一元运算符
     */
    public enum UnaryOp {
        NOT("not"),
        NEG("-"),
        POS("+");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        /** not 后跟空格，符号运算符紧贴操作数 */
        public String getSeparator() {
            return this == NOT ? " " : "";
        }

        public static UnaryOp fromSource(String source) {
            switch (source) {
                case "!":
                case "not":
                    return NOT;
                case "-":
                    return NEG;
                case "+":
                    return POS;
                default:
                    throw new IllegalArgumentException("Unsupported unary operator: " + source);
            }
        }
    }
}
