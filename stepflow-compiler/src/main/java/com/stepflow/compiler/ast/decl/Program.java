package com.stepflow.compiler.ast.decl;

import com.stepflow.compiler.ast.AstNode;
import com.stepflow.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）
 */
public class Program extends AstNode {
    private final List<FunctionDecl> functions;

    public Program(SourceLocation location, List<FunctionDecl> functions) {
        super(location);
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public List<FunctionDecl> getFunctions() {
        return functions;
    }
}
