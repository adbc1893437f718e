package com.cinder.ast;

import java.util.Objects;

public record ReturnStatement(String expression) implements Statement {

    public ReturnStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.RETURN;
    }

    @Override
    public String render() {
        return "return " + expression + ";";
    }
}
