package com.stepflow.compiler.ast.decl;

import com.stepflow.compiler.ast.AstNode;
import com.stepflow.compiler.ast.SourceLocation;
import com.stepflow.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数声明，每个函数降级为一个子工作流
 */
public class FunctionDecl extends AstNode {
    private final String name;
    private final List<Parameter> params;
    private final List<Statement> body;

    public FunctionDecl(SourceLocation location, String name, List<Parameter> params, List<Statement> body) {
        super(location);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParams() {
        return params;
    }

    public List<Statement> getBody() {
        return body;
    }

    public FunctionDecl withBody(List<Statement> newBody) {
        return new FunctionDecl(location, name, params, newBody);
    }
}
