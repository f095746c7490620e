package com.spreadsheet.formula.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * NAME(arg, ...). The name is not checked against any registry here;
 * an unknown name only becomes #NAME? when evaluated.
 */
public class FunctionCall extends AstNode {
    private final String name;
    private final List<AstNode> arguments;

    public FunctionCall(String name, List<AstNode> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<AstNode> getArguments() {
        return arguments;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
