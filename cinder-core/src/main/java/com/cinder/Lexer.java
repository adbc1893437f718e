package com.cinder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass tokenizer.
 *
 * <p>Raises no errors of its own. It checks the {@link Supervisor} before every token and
 * returns the end-of-file sentinel once an error has been recorded, so an outside failure
 * freezes the token list at the next token boundary.</p>
 */
public class Lexer {

    private final Cursor cursor;
    private final Supervisor supervisor;

    public Lexer(String source, Supervisor supervisor) {
        this.cursor = new Cursor(source);
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
    }

    /**
     * Tokenizes {@code source} until input runs out or {@code supervisor} reports an error.
     *
     * @return the tokens in source order, without the end-of-file sentinel
     */
    public static List<Token> lex(String source, Supervisor supervisor) {
        Lexer lexer = new Lexer(source, supervisor);

        List<Token> tokens = new ArrayList<>();
        while (!lexer.eof() && !supervisor.hasErrors()) {
            Token token = lexer.nextToken();
            if (!token.matches(TokenType.END_OF_FILE)) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public Token nextToken() {
        if (supervisor.hasErrors()) {
            return Token.endOfFile();
        }

        skipWhitespace();

        if (cursor.eof()) {
            return Token.endOfFile();
        }

        char ch = cursor.peek().orElseThrow();
        return switch (ch) {
            case '(' -> single(TokenType.LEFT_PAREN);
            case ')' -> single(TokenType.RIGHT_PAREN);
            case '{' -> single(TokenType.LEFT_BRACE);
            case '}' -> single(TokenType.RIGHT_BRACE);
            case ';' -> single(TokenType.SEMICOLON);
            case ',' -> single(TokenType.COMMA);
            case '*' -> single(TokenType.STAR);
            case '-' -> lexMinus();
            case '=' -> lexEqualSign();
            case '+' -> lexPlus();
            case '<' -> lexLessThan();
            default -> lexKeywordOrIdentifier();
        };
    }

    public boolean eof() {
        return cursor.eof();
    }

    public int position() {
        return cursor.cursor();
    }

    private void skipWhitespace() {
        while (!cursor.eof()) {
            char ch = cursor.peek().orElseThrow();
            if (ch != ' ' && ch != '\t' && ch != '\r' && ch != '\n') {
                break;
            }
            cursor.advance(1);
        }
    }

    private Token single(TokenType type) {
        return consume(type, 1);
    }

    private Token lexMinus() {
        if (nextIs('>')) {
            return consume(TokenType.ARROW, 2);
        }
        if (nextIs('-')) {
            return consume(TokenType.MINUS_MINUS, 2);
        }
        return consume(TokenType.MINUS, 1);
    }

    private Token lexEqualSign() {
        return nextIs('=') ? consume(TokenType.EQUAL_EQUAL, 2) : consume(TokenType.EQUAL, 1);
    }

    private Token lexPlus() {
        return nextIs('=') ? consume(TokenType.PLUS_EQUAL, 2) : consume(TokenType.PLUS, 1);
    }

    private Token lexLessThan() {
        return nextIs('=') ? consume(TokenType.LESS_EQUAL, 2) : consume(TokenType.LESS, 1);
    }

    private Token lexKeywordOrIdentifier() {
        int start = cursor.cursor();

        while (!cursor.eof() && isIdentifierPart(cursor.peek().orElseThrow())) {
            cursor.advance(1);
        }

        // A character with no rule of its own still becomes a token, whole code point included,
        // otherwise the scan would stall on it.
        if (cursor.cursor() == start) {
            cursor.advance(Character.charCount(cursor.source().codePointAt(start)));
        }

        String text = cursor.source().substring(start, cursor.cursor());
        TokenType type = TokenType.keyword(text).orElse(TokenType.IDENTIFIER);
        return new Token(type, text, new Position(start, cursor.cursor()));
    }

    private boolean nextIs(char expected) {
        return cursor.peekAhead(1).map(c -> c == expected).orElse(false);
    }

    private Token consume(TokenType type, int length) {
        int start = cursor.cursor();
        cursor.advance(length);
        int end = cursor.cursor();
        return new Token(type, cursor.source().substring(start, end), new Position(start, end));
    }

    private static boolean isIdentifierPart(char ch) {
        return (ch >= 'a' && ch <= 'z')
            || (ch >= 'A' && ch <= 'Z')
            || (ch >= '0' && ch <= '9')
            || ch == '_';
    }
}
