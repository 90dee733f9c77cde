package com.stepflow.ir.pass;

import com.stepflow.compiler.ast.expr.BinaryExpr;
import com.stepflow.compiler.ast.expr.ExprVisitor;
import com.stepflow.compiler.ast.expr.Expression;
import com.stepflow.compiler.ast.expr.FunctionInvocationExpr;
import com.stepflow.compiler.ast.expr.ListExpr;
import com.stepflow.compiler.ast.expr.MapExpr;
import com.stepflow.compiler.ast.expr.MemberExpr;
import com.stepflow.compiler.ast.expr.PrimitiveLiteral;
import com.stepflow.compiler.ast.expr.UnaryExpr;
import com.stepflow.compiler.ast.expr.VariableRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表达式变换基类：自底向上重建，子节点未变化时复用原节点。
 */
public abstract class ExpressionTransformer implements ExprVisitor<Expression> {

    public Expression transform(Expression expr) {
        return expr.accept(this);
    }

    @Override
    public Expression visitPrimitive(PrimitiveLiteral expr) {
        return expr;
    }

    @Override
    public Expression visitVariable(VariableRef expr) {
        return expr;
    }

    @Override
    public Expression visitList(ListExpr expr) {
        List<Expression> elements = new ArrayList<>();
        boolean changed = false;
        for (Expression e : expr.getElements()) {
            Expression t = transform(e);
            changed |= t != e;
            elements.add(t);
        }
        return changed ? new ListExpr(expr.getLocation(), elements) : expr;
    }

    @Override
    public Expression visitMap(MapExpr expr) {
        Map<String, Expression> entries = new LinkedHashMap<>();
        boolean changed = false;
        for (Map.Entry<String, Expression> entry : expr.getEntries().entrySet()) {
            Expression t = transform(entry.getValue());
            changed |= t != entry.getValue();
            entries.put(entry.getKey(), t);
        }
        return changed ? new MapExpr(expr.getLocation(), entries) : expr;
    }

    @Override
    public Expression visitMember(MemberExpr expr) {
        Expression object = transform(expr.getObject());
        Expression property = transform(expr.getProperty());
        if (object == expr.getObject() && property == expr.getProperty()) return expr;
        return new MemberExpr(expr.getLocation(), object, property, expr.isComputed());
    }

    @Override
    public Expression visitBinary(BinaryExpr expr) {
        Expression left = transform(expr.getLeft());
        Expression right = transform(expr.getRight());
        if (left == expr.getLeft() && right == expr.getRight()) return expr;
        return new BinaryExpr(expr.getLocation(), left, expr.getOperator(), right);
    }

    @Override
    public Expression visitUnary(UnaryExpr expr) {
        Expression operand = transform(expr.getOperand());
        if (operand == expr.getOperand()) return expr;
        return new UnaryExpr(expr.getLocation(), expr.getOperator(), operand);
    }

    @Override
    public Expression visitInvocation(FunctionInvocationExpr expr) {
        List<Expression> args = transformArguments(expr);
        if (args == expr.getArguments()) return expr;
        return new FunctionInvocationExpr(expr.getLocation(), expr.getFunctionName(), args);
    }

    protected List<Expression> transformArguments(FunctionInvocationExpr expr) {
        List<Expression> args = new ArrayList<>();
        boolean changed = false;
        for (Expression a : expr.getArguments()) {
            Expression t = transform(a);
            changed |= t != a;
            args.add(t);
        }
        return changed ? args : expr.getArguments();
    }
}
