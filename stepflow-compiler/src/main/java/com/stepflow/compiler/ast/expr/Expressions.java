package com.stepflow.compiler.ast.expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 表达式分类与输出值转换。
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * 转换为输出值：字面量得到普通值（null / Boolean / Long / Double / String / List / Map），
     * 含变量、调用、成员访问或运算的表达式得到 "${...}" 字符串。
     */
    public static Object toOutputValue(Expression expr) {
        if (expr instanceof PrimitiveLiteral) {
            return ((PrimitiveLiteral) expr).getValue();
        }
        if (expr instanceof ListExpr) {
            List<Object> values = new ArrayList<>();
            for (Expression e : ((ListExpr) expr).getElements()) {
                values.add(toOutputValue(e));
            }
            return values;
        }
        if (expr instanceof MapExpr) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, Expression> entry : ((MapExpr) expr).getEntries().entrySet()) {
                values.put(entry.getKey(), toOutputValue(entry.getValue()));
            }
            return values;
        }
        if (expr instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) expr;
            if (unary.getOperand() instanceof PrimitiveLiteral
                    && ((PrimitiveLiteral) unary.getOperand()).isNumber()) {
                Object value = ((PrimitiveLiteral) unary.getOperand()).getValue();
                if (unary.getOperator() == UnaryExpr.UnaryOp.POS) {
                    return value;
                }
                if (unary.getOperator() == UnaryExpr.UnaryOp.NEG) {
                    return negate(value);
                }
            }
        }
        return ExpressionRenderer.deferred(expr);
    }

    private static Object negate(Object number) {
        if (number instanceof Long && (Long) number != Long.MIN_VALUE) {
            return -(Long) number;
        }
        return -((Number) number).doubleValue();
    }

    /**
     * 是否为编译期字面量（不含变量、调用、成员访问、二元运算）。
     */
    public static boolean isLiteral(Expression expr) {
        if (expr instanceof PrimitiveLiteral) {
            return true;
        }
        if (expr instanceof ListExpr) {
            for (Expression e : ((ListExpr) expr).getElements()) {
                if (!isLiteral(e)) return false;
            }
            return true;
        }
        if (expr instanceof MapExpr) {
            for (Expression e : ((MapExpr) expr).getEntries().values()) {
                if (!isLiteral(e)) return false;
            }
            return true;
        }
        if (expr instanceof UnaryExpr) {
            return isLiteral(((UnaryExpr) expr).getOperand());
        }
        return false;
    }

    /**
     * 是否为限定名：标识符，或由标识符 / 基本字面量下标组成的成员访问链。
     */
    public static boolean isFullyQualifiedName(Expression expr) {
        if (expr instanceof VariableRef) {
            return true;
        }
        if (expr instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) expr;
            if (!isFullyQualifiedName(member.getObject())) {
                return false;
            }
            Expression property = member.getProperty();
            if (member.isComputed() && property instanceof PrimitiveLiteral) {
                return true;
            }
            return isFullyQualifiedName(property);
        }
        return false;
    }

    /**
     * 表达式树中任何位置都没有函数调用。
     */
    public static boolean isPure(Expression expr) {
        return !expr.accept(new ExpressionScanner<Boolean>() {
            @Override
            protected Boolean defaultResult() {
                return false;
            }

            @Override
            protected Boolean combine(Boolean a, Boolean b) {
                return a || b;
            }

            @Override
            public Boolean visitInvocation(FunctionInvocationExpr e) {
                return true;
            }
        });
    }

    /**
     * 收集表达式中引用的所有变量名（含成员链的根与非计算属性名）。
     */
    public static Set<String> referencedNames(Expression expr) {
        final Set<String> names = new LinkedHashSet<>();
        expr.accept(new ExpressionScanner<Void>() {
            @Override
            public Void visitVariable(VariableRef e) {
                names.add(e.getName());
                return null;
            }
        });
        return names;
    }

    /**
     * 判断表达式树中是否调用了给定名字的函数。
     */
    public static FunctionInvocationExpr findInvocation(Expression expr, final Set<String> functionNames) {
        return expr.accept(new ExpressionScanner<FunctionInvocationExpr>() {
            @Override
            protected FunctionInvocationExpr combine(FunctionInvocationExpr a, FunctionInvocationExpr b) {
                return a != null ? a : b;
            }

            @Override
            public FunctionInvocationExpr visitInvocation(FunctionInvocationExpr e) {
                if (functionNames.contains(e.getFunctionName())) {
                    return e;
                }
                return super.visitInvocation(e);
            }
        });
    }
}
