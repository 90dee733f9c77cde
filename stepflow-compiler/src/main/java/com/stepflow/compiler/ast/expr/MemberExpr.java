package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

/**
 * 成员访问：obj.prop 或 obj[prop]
 */
public class MemberExpr extends Expression {
    private final Expression object;
    private final Expression property;
    private final boolean computed;

    public MemberExpr(SourceLocation location, Expression object, Expression property, boolean computed) {
        super(location);
        this.object = object;
        this.property = property;
        this.computed = computed;
    }

    public MemberExpr(Expression object, Expression property, boolean computed) {
        this(null, object, property, computed);
    }

    /** obj.name */
    public static MemberExpr dot(Expression object, String name) {
        return new MemberExpr(object, new VariableRef(name), false);
    }

    public Expression getObject() {
        return object;
    }

    public Expression getProperty() {
        return property;
    }

    public boolean isComputed() {
        return computed;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMember(this);
    }
}
