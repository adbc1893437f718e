package com.cinder.ast;

import java.util.Objects;

public record FunctionCallStatement(String name, String arguments) implements Statement {

    public FunctionCallStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(arguments, "arguments");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.FUNCTION_CALL;
    }

    @Override
    public String render() {
        return name + "(" + arguments + ");";
    }
}
