package com.cinder.ast;

/**
 * Tag of each {@link Statement} variant.
 */
public enum StatementKind {
    EMPTY,
    BLOCK,
    MODULE,
    FUNCTION,
    IF,
    RETURN,
    VARIABLE,
    PLUS_EQUAL,
    WHILE,
    FOR,
    EXPRESSION,
    ARRAY,
    INDEX_OPERATOR,
    FUNCTION_CALL,
    STRUCT
}
