package com.cinder.ast;

import java.util.List;
import java.util.Objects;

/**
 * Struct definition emitted as a typedef. Each member is a declaration without its
 * trailing semicolon, e.g. {@code "int x"}.
 */
public record StructStatement(String name, List<String> members) implements Statement {

    public StructStatement {
        Objects.requireNonNull(name, "name");
        members = List.copyOf(members);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.STRUCT;
    }

    @Override
    public String render() {
        StringBuilder code = new StringBuilder();

        code.append("typedef struct ").append(name).append(" {\n");
        for (String member : members) {
            code.append("    ").append(member).append(";\n");
        }
        code.append("} ").append(name).append(";\n");

        return code.toString();
    }
}
