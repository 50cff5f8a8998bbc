package com.logix.laad.dsl;

/** A lexical token. {@code text} holds the decoded value for literals and comments. */
public record Token(TokenType type, String text, SourceSpan span) {

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return switch (type) {
            case IDENT, INT, FLOAT -> type.name().toLowerCase() + " '" + text + "'";
            case STRING -> "string \"" + text + "\"";
            default -> type.describe();
        };
    }
}
