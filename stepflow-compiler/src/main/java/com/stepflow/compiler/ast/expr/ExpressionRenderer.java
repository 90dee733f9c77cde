package com.stepflow.compiler.ast.expr;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.Map;
import java.util.StringJoiner;

/**
 * 表达式文本化（不含外层 ${}）。
 * 仅在子表达式优先级低于父运算符时加括号；右操作数同级时也加括号以保持求值顺序。
 */
public final class ExpressionRenderer implements ExprVisitor<String> {

    private static final ExpressionRenderer INSTANCE = new ExpressionRenderer();
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private ExpressionRenderer() {
    }

    public static String render(Expression expr) {
        return expr.accept(INSTANCE);
    }

    /** 包装为延迟求值表达式 ${...} */
    public static String deferred(Expression expr) {
        return "${" + render(expr) + "}";
    }

    /** JSON 字符串字面量 */
    public static String quote(String s) {
        return GSON.toJson(s);
    }

    /** 与输出中的纯数值同一写法 */
    public static String formatNumber(Object number) {
        double d = ((Number) number).doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return Double.toString(d);
        }
        return GSON.toJson(number);
    }

    @Override
    public String visitPrimitive(PrimitiveLiteral expr) {
        switch (expr.getKind()) {
            case NULL:
                return "null";
            case BOOLEAN:
                return expr.getValue().toString();
            case NUMBER:
                return formatNumber(expr.getValue());
            default:
                return quote((String) expr.getValue());
        }
    }

    @Override
    public String visitList(ListExpr expr) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Expression e : expr.getElements()) {
            joiner.add(e.accept(this));
        }
        return joiner.toString();
    }

    @Override
    public String visitMap(MapExpr expr) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Map.Entry<String, Expression> entry : expr.getEntries().entrySet()) {
            joiner.add(quote(entry.getKey()) + ": " + entry.getValue().accept(this));
        }
        return joiner.toString();
    }

    @Override
    public String visitVariable(VariableRef expr) {
        return expr.getName();
    }

    @Override
    public String visitMember(MemberExpr expr) {
        String object = expr.getObject().accept(this);
        if (expr.getObject() instanceof BinaryExpr || expr.getObject() instanceof UnaryExpr) {
            object = "(" + object + ")";
        }
        String property = expr.getProperty().accept(this);
        if (expr.isComputed()) {
            return object + "[" + property + "]";
        }
        return object + "." + property;
    }

    @Override
    public String visitBinary(BinaryExpr expr) {
        int precedence = expr.getOperator().getPrecedence();
        String left = expr.getLeft().accept(this);
        String right = expr.getRight().accept(this);
        if (expr.getLeft() instanceof BinaryExpr
                && ((BinaryExpr) expr.getLeft()).getOperator().getPrecedence() < precedence) {
            left = "(" + left + ")";
        }
        if (expr.getRight() instanceof BinaryExpr
                && ((BinaryExpr) expr.getRight()).getOperator().getPrecedence() <= precedence) {
            right = "(" + right + ")";
        }
        return left + " " + expr.getOperator().getSymbol() + " " + right;
    }

    @Override
    public String visitUnary(UnaryExpr expr) {
        String operand = expr.getOperand().accept(this);
        if (expr.getOperand() instanceof BinaryExpr) {
            operand = "(" + operand + ")";
        } else if (expr.getOperand() instanceof UnaryExpr && expr.getOperator().getSeparator().isEmpty()) {
            // -(-5) 不能写成 --5
            operand = "(" + operand + ")";
        }
        return expr.getOperator().getSymbol() + expr.getOperator().getSeparator() + operand;
    }

    @Override
    public String visitInvocation(FunctionInvocationExpr expr) {
        StringJoiner joiner = new StringJoiner(", ", expr.getFunctionName() + "(", ")");
        for (Expression arg : expr.getArguments()) {
            joiner.add(arg.accept(this));
        }
        return joiner.toString();
    }
}
