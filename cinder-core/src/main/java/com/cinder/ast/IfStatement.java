package com.cinder.ast;

import java.util.Objects;

public record IfStatement(
    String condition,
    BlockStatement thenBlock,
    BlockStatement elseBlock  // Empty when there is no else branch
) implements Statement {

    public IfStatement {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBlock, "thenBlock");
        Objects.requireNonNull(elseBlock, "elseBlock");
    }

    public IfStatement(String condition, BlockStatement thenBlock) {
        this(condition, thenBlock, BlockStatement.empty());
    }

    @Override
    public StatementKind kind() {
        return StatementKind.IF;
    }

    @Override
    public String render() {
        StringBuilder code = new StringBuilder();

        code.append("if (").append(condition).append(") {\n");
        code.append(thenBlock.render());

        if (!elseBlock.isEmpty()) {
            code.append("} else {\n");
            code.append(elseBlock.render());
        }

        code.append("}\n");
        return code.toString();
    }
}
