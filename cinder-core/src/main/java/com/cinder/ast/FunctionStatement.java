package com.cinder.ast;

import com.cinder.types.BuiltinType;
import com.cinder.types.TypeMapper;

import java.util.Objects;

/**
 * Function definition. {@code parameters} is the raw parameter list as the parser captured it,
 * for example {@code "int a, mut int* out"}; see {@link ParameterList} for its grammar.
 */
public record FunctionStatement(
    String name,
    String parameters,
    BuiltinType returnType,
    BlockStatement body
) implements Statement {

    public FunctionStatement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(body, "body");
        // Reject malformed lists up front so render() cannot fail
        ParameterList.parse(parameters);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.FUNCTION;
    }

    @Override
    public String render() {
        return TypeMapper.builtinTypeToCType(returnType) + " " + name
            + "(" + ParameterList.parse(parameters).render() + ") {\n"
            + body.render()
            + "}\n";
    }
}
