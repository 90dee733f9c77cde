package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表字面量
 */
public class ListExpr extends Expression {
    private final List<Expression> elements;

    public ListExpr(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public ListExpr(List<Expression> elements) {
        this(null, elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
