package com.cinder;

import java.util.Objects;

public record Token(TokenType type, String text, Position span) {

    private static final Token END_OF_FILE = new Token(TokenType.END_OF_FILE, "", Position.NONE);

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(span, "span");
    }

    /**
     * Sentinel returned once input is exhausted or lexing was cancelled. Never part of a lexed token list.
     */
    public static Token endOfFile() {
        return END_OF_FILE;
    }

    public boolean matches(TokenType expected) {
        return type == expected;
    }

    public boolean matchesAny(TokenType... expected) {
        for (TokenType candidate : expected) {
            if (type == candidate) {
                return true;
            }
        }
        return false;
    }
}
