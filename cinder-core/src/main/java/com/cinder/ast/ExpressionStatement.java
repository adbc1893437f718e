package com.cinder.ast;

import java.util.Objects;

public record ExpressionStatement(String expression) implements Statement {

    public ExpressionStatement {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.EXPRESSION;
    }

    @Override
    public String render() {
        return expression + ";";
    }
}
