package com.logix.laad.dsl;

import com.logix.laad.error.SyntaxException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class LexerTest {

    private static List<TokenType> types(String source) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize())
            out.add(t.type());
        return out;
    }

    @Test
    public void testEmptyInput() {
        assertEquals(List.of(TokenType.EOF), types(""));
    }

    @Test
    public void testConnectionTokens() {
        assertEquals(List.of(TokenType.STRING, TokenType.ARROW, TokenType.IDENT, TokenType.EOF),
                types("\"Hello, World!\" -> display"));
    }

    @Test
    public void testNewlinesAreSignificant() {
        assertEquals(List.of(TokenType.IDENT, TokenType.NEWLINE, TokenType.IDENT, TokenType.EOF),
                types("a\r\n\tb"));
    }

    @Test
    public void testKeywords() {
        assertEquals(List.of(TokenType.IF, TokenType.THEN, TokenType.ELSEIF, TokenType.ELSE, TokenType.END,
                TokenType.ENDIF, TokenType.WHILE, TokenType.FOR, TokenType.MATCH, TokenType.NULL, TokenType.EOF),
                types("if then elseif else end endif while for match null"));
    }

    @Test
    public void testRangeIsNotAFloat() {
        assertEquals(List.of(TokenType.INT, TokenType.DOT_DOT, TokenType.INT, TokenType.EOF), types("0..5"));
        assertEquals(List.of(TokenType.FLOAT, TokenType.EOF), types("0.5"));
    }

    @Test
    public void testMultiCharSymbols() {
        assertEquals(List.of(TokenType.SPACESHIP, TokenType.LE, TokenType.SHL, TokenType.SHR, TokenType.GE,
                TokenType.EQ, TokenType.NE, TokenType.AND_AND, TokenType.PIPE_PIPE, TokenType.EOF),
                types("<=> <= << >> >= == != && ||"));
    }

    @Test
    public void testStringEscapes() {
        Token t = new Lexer("\"a\\\"b\\n\\\\\"").tokenize().get(0);
        assertEquals(TokenType.STRING, t.type());
        assertEquals("a\"b\n\\", t.text());
    }

    @Test
    public void testCommentKeepsText() {
        List<Token> tokens = new Lexer("x // note here\n").tokenize();
        assertEquals(TokenType.COMMENT, tokens.get(1).type());
        assertEquals("note here", tokens.get(1).text());
        assertEquals(TokenType.NEWLINE, tokens.get(2).type());
    }

    @Test
    public void testSpansAreOneBased() {
        List<Token> tokens = new Lexer("a\n  bc").tokenize();
        Token bc = tokens.get(2);
        assertEquals(2, bc.span().line());
        assertEquals(3, bc.span().column());
        assertEquals(4, bc.span().offset());
        assertEquals(2, bc.span().length());
    }

    @Test(expected = SyntaxException.class)
    public void testByteOrderMarkRejected() {
        new Lexer("\uFEFFa -> b").tokenize();
    }

    @Test(expected = SyntaxException.class)
    public void testUnterminatedString() {
        new Lexer("\"abc").tokenize();
    }

    @Test(expected = SyntaxException.class)
    public void testUnknownCharacter() {
        new Lexer("a @ b").tokenize();
    }

    @Test(expected = SyntaxException.class)
    public void testIdentifiersAreAscii() {
        new Lexer("caf\u00e9 = 1").tokenize();
    }

    @Test(expected = SyntaxException.class)
    public void testDigitsAreAscii() {
        new Lexer("x = 1\u0663").tokenize();
    }

    @Test
    public void testUnderscoreIdentifier() {
        assertEquals(List.of(TokenType.IDENT, TokenType.EOF), types("_a1_B"));
    }
}
