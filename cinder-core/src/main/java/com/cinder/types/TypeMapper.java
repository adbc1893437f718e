package com.cinder.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps source-language types to their C spelling.
 */
public final class TypeMapper {

    private TypeMapper() {
        // Utility class
    }

    public static String builtinTypeToCType(BuiltinType type) {
        return Objects.requireNonNull(type, "type").cName();
    }

    /**
     * Maps a type written in source. Builtin names become their C spelling; any other name
     * (a struct declared in the same module, say) is already a C type name and is returned as is.
     */
    public static String builtinTypeToCType(String name) {
        Objects.requireNonNull(name, "name");
        return BuiltinType.fromName(name).map(BuiltinType::cName).orElse(name);
    }

    /**
     * Standard headers a translation unit using {@code types} has to include, in a stable order.
     * Names keep their angle brackets, the form {@code ModuleStatement} expects.
     */
    public static List<String> headersFor(Iterable<BuiltinType> types) {
        boolean needsBool = false;
        boolean needsStdint = false;
        for (BuiltinType type : types) {
            needsBool |= type == BuiltinType.BOOL;
            needsStdint |= type.isFixedWidth();
        }

        List<String> headers = new ArrayList<>();
        if (needsBool) {
            headers.add("<stdbool.h>");
        }
        if (needsStdint) {
            headers.add("<stdint.h>");
        }
        return headers;
    }
}
