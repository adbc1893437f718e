package com.cinder;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static final Supervisor NO_ERRORS = () -> false;

    private static List<Token> lex(String source) {
        return Lexer.lex(source, NO_ERRORS);
    }

    private static String types(List<Token> tokens) {
        return tokens.stream().map(t -> t.type().name()).collect(Collectors.joining(" "));
    }

    @Test
    void testWhitespaceOnlyYieldsNoTokens() {
        assertTrue(lex("").isEmpty());
        assertTrue(lex(" \t\r\n  \n").isEmpty());
    }

    @Test
    void testPunctuation() {
        List<Token> tokens = lex("( ) { } ; ,");
        assertEquals("LEFT_PAREN RIGHT_PAREN LEFT_BRACE RIGHT_BRACE SEMICOLON COMMA", types(tokens));
    }

    @Test
    void testMaximalMunch() {
        assertEquals("ARROW", types(lex("->")));
        assertEquals("MINUS_MINUS", types(lex("--")));
        assertEquals("MINUS IDENTIFIER", types(lex("-x")));
        assertEquals("EQUAL_EQUAL", types(lex("==")));
        assertEquals("EQUAL IDENTIFIER", types(lex("=a")));
        assertEquals("PLUS_EQUAL", types(lex("+=")));
        assertEquals("PLUS PLUS", types(lex("++")));
        assertEquals("LESS_EQUAL", types(lex("<=")));
        assertEquals("LESS MINUS", types(lex("<-")));
        assertEquals("STAR STAR", types(lex("**")));
    }

    @Test
    void testMunchIsGreedyLeftToRight() {
        // "--->" is "--" then "->"
        assertEquals("MINUS_MINUS ARROW", types(lex("--->")));
        // "===" is "==" then "="
        assertEquals("EQUAL_EQUAL EQUAL", types(lex("===")));
    }

    @Test
    void testOperatorAtEndOfInput() {
        List<Token> tokens = lex("x -");
        assertEquals("IDENTIFIER MINUS", types(tokens));
        assertEquals(new Position(2, 3), tokens.get(1).span());
    }

    @Test
    void testKeywordsAndIdentifiers() {
        List<Token> tokens = lex("fn main mut return if else while for struct module include true false");
        assertEquals(
            "FN IDENTIFIER MUT RETURN IF ELSE WHILE FOR STRUCT MODULE INCLUDE TRUE FALSE",
            types(tokens));
        assertEquals("main", tokens.get(1).text());
    }

    @Test
    void testKeywordPrefixIsIdentifier() {
        List<Token> tokens = lex("fns mutable return_value Fn _if");
        assertTrue(tokens.stream().allMatch(t -> t.matches(TokenType.IDENTIFIER)), types(tokens));
    }

    @Test
    void testIdentifiersMayContainDigitsAndUnderscores() {
        List<Token> tokens = lex("x1 _tmp a_b_2");
        assertEquals(List.of("x1", "_tmp", "a_b_2"), tokens.stream().map(Token::text).toList());
    }

    @Test
    void testDigitsScanAsIdentifierRun() {
        List<Token> tokens = lex("10;");
        assertEquals("IDENTIFIER SEMICOLON", types(tokens));
        assertEquals("10", tokens.get(0).text());
    }

    @Test
    void testUnrecognizedCharacterBecomesSingleCharacterToken() {
        List<Token> tokens = lex("a # b");
        assertEquals("IDENTIFIER IDENTIFIER IDENTIFIER", types(tokens));
        assertEquals("#", tokens.get(1).text());
        assertEquals(new Position(2, 3), tokens.get(1).span());
    }

    @Test
    void testSpansAreHalfOpenAndMonotonic() {
        String source = "fn add(int a) -> int {\n  return a+=1;\n}";
        List<Token> tokens = lex(source);

        int previousEnd = 0;
        for (Token token : tokens) {
            assertTrue(token.span().start() >= previousEnd, "overlap at " + token);
            assertEquals(token.text(), token.span().slice(source));
            previousEnd = token.span().end();
        }

        Token arrow = tokens.stream().filter(t -> t.matches(TokenType.ARROW)).findFirst().orElseThrow();
        assertEquals(new Position(14, 16), arrow.span());
        assertEquals(new Position(0, 2), tokens.get(0).span());
    }

    @Test
    void testSpansReconstructSourceWithoutWhitespace() {
        String source = "while (i <= n) {\n\ti += 2;\n\tf(i, -i);\n}\n";
        String rebuilt = lex(source).stream()
            .map(t -> t.span().slice(source))
            .collect(Collectors.joining());
        assertEquals(source.replaceAll("[ \t\r\n]", ""), rebuilt);
    }

    @Test
    void testNextTokenReturnsSentinelAtEndOfInput() {
        Lexer lexer = new Lexer("  ", NO_ERRORS);
        Token token = lexer.nextToken();
        assertTrue(token.matches(TokenType.END_OF_FILE));
        assertTrue(lexer.eof());
    }

    @Test
    void testRecordedErrorStopsLexingImmediately() {
        ErrorSupervisor supervisor = new ErrorSupervisor();
        supervisor.report("parse failed", Position.NONE);

        assertTrue(Lexer.lex("fn main", supervisor).isEmpty());

        Lexer lexer = new Lexer("fn main", supervisor);
        assertTrue(lexer.nextToken().matches(TokenType.END_OF_FILE));
        assertEquals(0, lexer.position(), "no input consumed once cancelled");
    }

    @Test
    void testErrorRecordedMidLexFreezesTokenCount() {
        AtomicInteger polls = new AtomicInteger();
        // Errors appear after a few checks; the lexer checks both in lex() and in nextToken()
        Supervisor supervisor = () -> polls.incrementAndGet() > 4;

        List<Token> tokens = Lexer.lex("a b c d e f g", supervisor);
        assertEquals(2, tokens.size());
        assertEquals("a", tokens.get(0).text());
        assertEquals("b", tokens.get(1).text());
    }

    @Test
    void testWarningsDoNotCancel() {
        ErrorSupervisor supervisor = new ErrorSupervisor();
        supervisor.warn("unused", Position.NONE);
        assertEquals(3, Lexer.lex("a b c", supervisor).size());
    }

    @Test
    void testSupplementaryCharacterBecomesOneToken() {
        String source = "a\uD83D\uDE00b";
        List<Token> tokens = lex(source);

        assertEquals(3, tokens.size());
        assertEquals("\uD83D\uDE00", tokens.get(1).text());
        assertEquals(new Position(1, 3), tokens.get(1).span());
        assertEquals("b", tokens.get(2).text());
    }
}
