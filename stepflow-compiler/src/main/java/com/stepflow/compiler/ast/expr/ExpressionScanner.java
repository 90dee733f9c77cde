package com.stepflow.compiler.ast.expr;

/**
 * 遍历整棵表达式树并合并各子节点结果的访问者基类。
 *
 * @param <R> 结果类型
 */
public abstract class ExpressionScanner<R> implements ExprVisitor<R> {

    protected R defaultResult() {
        return null;
    }

    protected R combine(R a, R b) {
        return b != null ? b : a;
    }

    @Override
    public R visitPrimitive(PrimitiveLiteral expr) {
        return defaultResult();
    }

    @Override
    public R visitList(ListExpr expr) {
        R result = defaultResult();
        for (Expression e : expr.getElements()) {
            result = combine(result, e.accept(this));
        }
        return result;
    }

    @Override
    public R visitMap(MapExpr expr) {
        R result = defaultResult();
        for (Expression e : expr.getEntries().values()) {
            result = combine(result, e.accept(this));
        }
        return result;
    }

    @Override
    public R visitVariable(VariableRef expr) {
        return defaultResult();
    }

    @Override
    public R visitMember(MemberExpr expr) {
        return combine(expr.getObject().accept(this), expr.getProperty().accept(this));
    }

    @Override
    public R visitBinary(BinaryExpr expr) {
        return combine(expr.getLeft().accept(this), expr.getRight().accept(this));
    }

    @Override
    public R visitUnary(UnaryExpr expr) {
        return expr.getOperand().accept(this);
    }

    @Override
    public R visitInvocation(FunctionInvocationExpr expr) {
        R result = defaultResult();
        for (Expression arg : expr.getArguments()) {
            result = combine(result, arg.accept(this));
        }
        return result;
    }
}
