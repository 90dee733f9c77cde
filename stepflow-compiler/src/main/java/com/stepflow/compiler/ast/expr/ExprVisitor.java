package com.stepflow.compiler.ast.expr;

/**
 * 表达式访问者
 *
 * @param <R> 返回类型
 */
public interface ExprVisitor<R> {

    R visitPrimitive(PrimitiveLiteral expr);

    R visitList(ListExpr expr);

    R visitMap(MapExpr expr);

    R visitVariable(VariableRef expr);

    R visitMember(MemberExpr expr);

    R visitBinary(BinaryExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitInvocation(FunctionInvocationExpr expr);
}
