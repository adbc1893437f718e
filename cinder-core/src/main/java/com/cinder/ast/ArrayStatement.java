package com.cinder.ast;

import com.cinder.types.BuiltinType;
import com.cinder.types.TypeMapper;

import java.util.Objects;

/**
 * Array declaration. {@code typeExtensions} holds the subscript ({@code [3]}) and follows the
 * name; {@code elements} is the initializer list already joined by the parser.
 */
public record ArrayStatement(
    boolean mutable,
    BuiltinType type,
    String typeExtensions,
    String name,
    String elements
) implements Statement {

    public ArrayStatement {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(typeExtensions, "typeExtensions");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(elements, "elements");
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ARRAY;
    }

    // The qualifier slot is always followed by a space, so const arrays carry two.
    @Override
    public String render() {
        String mutability = mutable ? "" : "const ";
        return mutability + " " + TypeMapper.builtinTypeToCType(type) + " " + name + typeExtensions
            + " = { " + elements + " };";
    }
}
