package com.cinder.ast;

import java.util.Objects;

public record PlusEqualStatement(String name, String expression) implements Statement {

    public PlusEqualStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.PLUS_EQUAL;
    }

    @Override
    public String render() {
        return name + " += " + expression + ";";
    }
}
