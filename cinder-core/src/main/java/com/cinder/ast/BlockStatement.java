package com.cinder.ast;

import java.util.List;

public record BlockStatement(List<Statement> statements) implements Statement {

    private static final BlockStatement EMPTY = new BlockStatement(List.of());

    public BlockStatement {
        statements = List.copyOf(statements);
    }

    public static BlockStatement of(Statement... statements) {
        return new BlockStatement(List.of(statements));
    }

    public static BlockStatement empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public StatementKind kind() {
        return StatementKind.BLOCK;
    }

    /**
     * Renders each child on its own line. Empty children contribute nothing, not even a newline.
     */
    @Override
    public String render() {
        StringBuilder code = new StringBuilder();
        for (Statement statement : statements) {
            code.append(statement.render());
            if (statement.kind() != StatementKind.EMPTY) {
                code.append('\n');
            }
        }
        return code.toString();
    }
}
