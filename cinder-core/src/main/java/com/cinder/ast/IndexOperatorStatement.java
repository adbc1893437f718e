package com.cinder.ast;

import java.util.Objects;

/**
 * Assignment through a subscript, {@code name[index] = expression;}.
 */
public record IndexOperatorStatement(String name, String index, String expression) implements Statement {

    public IndexOperatorStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.INDEX_OPERATOR;
    }

    @Override
    public String render() {
        return name + "[" + index + "] = " + expression + ";";
    }
}
