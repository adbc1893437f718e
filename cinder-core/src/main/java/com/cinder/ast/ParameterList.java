package com.cinder.ast;

import com.cinder.types.TypeMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses a raw, comma-separated parameter list such as {@code "mut int* xs, int n"} and renders
 * it as a C parameter list.
 *
 * <p>Each parameter reads {@code [mut] <type> [extension...] <name>}. The pieces between the type
 * and the name are appended to the C type with no separator. Parameters without {@code mut} are
 * emitted {@code const}.</p>
 */
final class ParameterList {

    private record Parameter(boolean mutable, String type, String typeExtensions, String name) {

        String render() {
            return (mutable ? "" : "const ")
                + TypeMapper.builtinTypeToCType(type) + typeExtensions + " " + name;
        }
    }

    private final List<Parameter> parameters;

    private ParameterList(List<Parameter> parameters) {
        this.parameters = parameters;
    }

    /**
     * @throws IllegalArgumentException if a parameter lacks a type or a name
     */
    static ParameterList parse(String raw) {
        List<Parameter> parameters = new ArrayList<>();
        if (raw.isBlank()) {
            return new ParameterList(parameters);
        }

        for (String argument : raw.split(",", -1)) {
            List<String> pieces = Arrays.stream(argument.split(" "))
                .filter(piece -> !piece.isEmpty())
                .toList();

            boolean mutable = !pieces.isEmpty() && pieces.get(0).equals("mut");
            List<String> rest = mutable ? pieces.subList(1, pieces.size()) : pieces;
            if (rest.size() < 2) {
                throw new IllegalArgumentException("Malformed parameter '" + argument.trim() + "' in '" + raw + "'");
            }

            String type = rest.get(0);
            String typeExtensions = String.join("", rest.subList(1, rest.size() - 1));
            String name = rest.get(rest.size() - 1);
            parameters.add(new Parameter(mutable, type, typeExtensions, name));
        }
        return new ParameterList(parameters);
    }

    String render() {
        List<String> rendered = new ArrayList<>(parameters.size());
        for (Parameter parameter : parameters) {
            rendered.add(parameter.render());
        }
        return String.join(", ", rendered);
    }
}
