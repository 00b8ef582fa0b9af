package com.oclparser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    private static List<TokenType> types(String source) {
        return tokenize(source).stream().map(Token::type).toList();
    }

    @Test
    void testAttributeTokens() {
        List<Token> tokens = tokenize("name = \"x\"");

        assertEquals(4, tokens.size());
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("name", tokens.get(0).lexeme());
        assertEquals(TokenType.EQUAL, tokens.get(1).type());
        assertEquals(5, tokens.get(1).column());
        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals("\"x\"", tokens.get(2).lexeme());
        assertEquals(7, tokens.get(2).position());
        assertEquals(10, tokens.get(2).endPosition());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    void testPunctuation() {
        assertEquals(
            List.of(TokenType.LBRACE, TokenType.RBRACE, TokenType.LBRACKET, TokenType.RBRACKET,
                TokenType.EQUAL, TokenType.COMMA, TokenType.EOF),
            types("{ } [ ] = ,"));
    }

    @Test
    void testIdentifiersMayContainDotsAndDashes() {
        List<Token> tokens = tokenize("Octopus.Action.Max-Parallelism _private");

        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
        assertEquals("Octopus.Action.Max-Parallelism", tokens.get(0).lexeme());
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type());
        assertEquals("_private", tokens.get(1).lexeme());
    }

    @Test
    void testBooleanKeywords() {
        assertEquals(List.of(TokenType.TRUE, TokenType.FALSE, TokenType.IDENTIFIER, TokenType.EOF),
            types("true false truthy"));
    }

    @Test
    void testNumbers() {
        List<Token> tokens = tokenize("-1.5e10 42 007 3E-2");

        assertEquals("-1.5e10", tokens.get(0).lexeme());
        assertEquals("42", tokens.get(1).lexeme());
        assertEquals("007", tokens.get(2).lexeme());
        assertEquals("3E-2", tokens.get(3).lexeme());
        for (int i = 0; i < 4; i++) {
            assertEquals(TokenType.NUMBER, tokens.get(i).type());
        }
    }

    @Test
    void testCommentsAreSkipped() {
        List<Token> tokens = tokenize("# hash\n// slashes\n/* multi\nline */ a");

        assertEquals(2, tokens.size());
        Token a = tokens.get(0);
        assertEquals("a", a.lexeme());
        assertEquals(4, a.line());
        assertEquals(8, a.column());
    }

    @Test
    void testCrlfIsOneLineBreak() {
        Token b = tokenize("a\r\nb").get(1);

        assertEquals("b", b.lexeme());
        assertEquals(2, b.line());
        assertEquals(0, b.column());
    }

    @Test
    void testIllegalCharacters() {
        List<Token> tokens = tokenize("a @ b");

        assertEquals(TokenType.ILLEGAL, tokens.get(1).type());
        assertEquals("@", tokens.get(1).lexeme());
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type());
    }

    @Test
    void testDoubleAngleWithoutDelimiterIsNotAHeredoc() {
        assertEquals(
            List.of(TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.ILLEGAL, TokenType.ILLEGAL,
                TokenType.IDENTIFIER, TokenType.EOF),
            types("x = << y"));
    }

    @Test
    void testUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = \"abc"));

        assertEquals(ParseException.LEXICAL_ERROR, e.getErrorType());
        assertEquals(1, e.getLine());
        assertEquals(4, e.getColumn());
        assertEquals(4, e.getPosition());
        assertEquals("Unterminated string literal", e.getReason());
        assertEquals("LexicalError at line 1, column 4: Unterminated string literal", e.getMessage());
    }

    @Test
    void testStringCannotSpanLines() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = \"abc\ny = 1"));
        assertEquals(1, e.getLine());
    }

    @Test
    void testInvalidEscape() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("x = \"a\\qb\""));

        assertTrue(e.getReason().startsWith("Invalid escape sequence"), e.getReason());
        assertEquals(6, e.getColumn());
    }

    @Test
    void testValidEscapes() {
        List<Token> tokens = tokenize("\"a\\\"b\\\\c\\n\\u00e9\"");

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals(TokenType.EOF, tokens.get(1).type());
    }

    @Test
    void testUnterminatedBlockComment() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("a = 1\n/* never closed"));

        assertEquals("Unterminated block comment", e.getReason());
        assertEquals(2, e.getLine());
        assertEquals(0, e.getColumn());
    }

    @Test
    void testEofPosition() {
        List<Token> tokens = tokenize("a = 1\n");
        Token eof = tokens.get(tokens.size() - 1);

        assertEquals(TokenType.EOF, eof.type());
        assertEquals(2, eof.line());
        assertEquals(0, eof.column());
        assertEquals(6, eof.position());
    }
}
