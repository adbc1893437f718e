package com.cinder.ast;

import java.util.Objects;

public record WhileStatement(String condition, BlockStatement body) implements Statement {

    public WhileStatement {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.WHILE;
    }

    @Override
    public String render() {
        return "while (" + condition + ") {\n"
            + body.render()
            + "}\n";
    }
}
