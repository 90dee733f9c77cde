package com.stepflow.compiler.ast.expr;

import com.stepflow.compiler.ast.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map 字面量（键有序）
 */
public class MapExpr extends Expression {
    private final Map<String, Expression> entries;

    public MapExpr(SourceLocation location, Map<String, Expression> entries) {
        super(location);
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public MapExpr(Map<String, Expression> entries) {
        this(null, entries);
    }

    public Map<String, Expression> getEntries() {
        return entries;
    }

    public Expression get(String key) {
        return entries.get(key);
    }

    public boolean has(String key) {
        return entries.containsKey(key);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMap(this);
    }
}
