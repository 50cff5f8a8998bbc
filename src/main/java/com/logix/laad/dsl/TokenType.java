package com.logix.laad.dsl;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    IDENT(null),
    INT(null),
    FLOAT(null),
    STRING(null),
    COMMENT(null),
    NEWLINE(null),
    EOF(null),

    // ── Keywords ──
    IMPORT("import"),
    AS("as"),
    CLASS("class"),
    IN("in"),
    OUT("out"),
    IF("if"),
    THEN("then"),
    ELSEIF("elseif"),
    ELSE("else"),
    END("end"),
    ENDIF("endif"),
    WHILE("while"),
    WEND("wend"),
    FOR("for"),
    MATCH("match"),
    TRUE("true"),
    FALSE("false"),
    NULL("null"),

    // ── Symbols ──
    ASSIGN("="),
    ARROW("->"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    AMP("&"),
    PIPE("|"),
    CARET("^"),
    BANG("!"),
    TILDE("~"),
    SHL("<<"),
    SHR(">>"),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    EQ("=="),
    NE("!="),
    AND_AND("&&"),
    PIPE_PIPE("||"),
    SPACESHIP("<=>"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),
    COMMA(","),
    COLON(":"),
    DOT("."),
    DOT_DOT(".."),
    HASH("#");

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType t : values())
            if (t.text != null && Character.isLetter(t.text.charAt(0)))
                KEYWORDS.put(t.text, t);
    }

    private final String text;

    TokenType(String text) {
        this.text = text;
    }

    /** Fixed spelling of keywords and symbols; {@code null} for literal classes. */
    public String text() {
        return text;
    }

    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }

    public String describe() {
        return text != null ? "'" + text + "'" : name().toLowerCase();
    }
}
