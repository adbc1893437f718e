package com.cinder;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum TokenType {
    END_OF_FILE,
    IDENTIFIER,

    // Keywords
    FN("fn"),
    MUT("mut"),
    RETURN("return"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    FOR("for"),
    STRUCT("struct"),
    MODULE("module"),
    INCLUDE("include"),
    TRUE("true"),
    FALSE("false"),

    // Punctuation
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    SEMICOLON,
    COMMA,

    // Operators
    MINUS,
    ARROW,
    MINUS_MINUS,
    EQUAL,
    EQUAL_EQUAL,
    STAR,
    PLUS,
    PLUS_EQUAL,
    LESS,
    LESS_EQUAL;

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.spelling != null) {
                KEYWORDS.put(type.spelling, type);
            }
        }
    }

    private final String spelling;

    TokenType() {
        this(null);
    }

    TokenType(String spelling) {
        this.spelling = spelling;
    }

    /**
     * Looks up a reserved word. Matching is exact and case-sensitive.
     */
    public static Optional<TokenType> keyword(String text) {
        return Optional.ofNullable(KEYWORDS.get(text));
    }

    public boolean isKeyword() {
        return spelling != null;
    }

    public boolean isPunctuation() {
        return switch (this) {
            case LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, SEMICOLON, COMMA -> true;
            default -> false;
        };
    }

    public boolean isOperator() {
        return switch (this) {
            case MINUS, ARROW, MINUS_MINUS, EQUAL, EQUAL_EQUAL, STAR, PLUS, PLUS_EQUAL, LESS, LESS_EQUAL -> true;
            default -> false;
        };
    }

    /**
     * The reserved spelling of a keyword, or {@code null} for every other type.
     */
    public String spelling() {
        return spelling;
    }
}
