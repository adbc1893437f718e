package com.cinder.types;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Primitive types of the source language, each paired with its C spelling.
 */
public enum BuiltinType {
    VOID("void", "void"),
    BOOL("bool", "bool"),
    CHAR("char", "char"),
    INT("int", "int"),
    I8("i8", "int8_t"),
    I16("i16", "int16_t"),
    I32("i32", "int32_t"),
    I64("i64", "int64_t"),
    U8("u8", "uint8_t"),
    U16("u16", "uint16_t"),
    U32("u32", "uint32_t"),
    U64("u64", "uint64_t"),
    F32("f32", "float"),
    F64("f64", "double"),
    STRING("string", "char*");

    private static final Map<String, BuiltinType> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(BuiltinType::sourceName, Function.identity()));

    private final String sourceName;
    private final String cName;

    BuiltinType(String sourceName, String cName) {
        this.sourceName = sourceName;
        this.cName = cName;
    }

    public static Optional<BuiltinType> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String sourceName() {
        return sourceName;
    }

    public String cName() {
        return cName;
    }

    /**
     * True for the fixed-width integers that need {@code <stdint.h>}.
     */
    public boolean isFixedWidth() {
        return cName.endsWith("_t");
    }
}
