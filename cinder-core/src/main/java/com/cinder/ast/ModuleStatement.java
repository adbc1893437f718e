package com.cinder.ast;

import java.util.List;
import java.util.Objects;

/**
 * A whole translation unit: includes, then struct definitions, then functions.
 *
 * <p>Includes are stored as written in source, still wrapped in their delimiters
 * ({@code "stdio.h"} or {@code <stdio.h>}); the first and last characters are replaced by angle
 * brackets on output.</p>
 */
public record ModuleStatement(
    String name,
    List<String> includes,
    BlockStatement structs,
    BlockStatement functions
) implements Statement {

    public ModuleStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(structs, "structs");
        Objects.requireNonNull(functions, "functions");
        includes = List.copyOf(includes);
        for (String include : includes) {
            if (include.length() < 2) {
                throw new IllegalArgumentException("Include '" + include + "' has no delimiters");
            }
        }
    }

    @Override
    public StatementKind kind() {
        return StatementKind.MODULE;
    }

    @Override
    public String render() {
        StringBuilder code = new StringBuilder();

        for (String include : includes) {
            code.append("#include <")
                .append(include, 1, include.length() - 1)
                .append(">\n");
        }
        code.append('\n');

        code.append(structs.render());
        code.append('\n');

        code.append(functions.render());

        return code.toString();
    }
}
