package com.cinder.ast;

import com.cinder.types.BuiltinType;
import com.cinder.types.TypeMapper;

import java.util.Objects;

/**
 * Variable declaration with initializer. {@code typeExtensions} (such as {@code *}) follows the
 * C type directly.
 */
public record VariableStatement(
    boolean mutable,
    BuiltinType type,
    String typeExtensions,
    String name,
    String expression
) implements Statement {

    public VariableStatement {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(typeExtensions, "typeExtensions");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.VARIABLE;
    }

    @Override
    public String render() {
        String mutability = mutable ? "" : "const ";
        return mutability + TypeMapper.builtinTypeToCType(type) + typeExtensions + " " + name
            + " = " + expression + ";";
    }
}
