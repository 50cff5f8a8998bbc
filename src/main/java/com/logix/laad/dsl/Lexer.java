package com.logix.laad.dsl;

import com.logix.laad.error.SyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written scanner for LaaD source text.
 *
 * <p>
 * Newlines are significant and come out as {@link TokenType#NEWLINE}; every other
 * whitespace character is skipped. Comments run from {@code //} to the end of the
 * line and are kept as {@link TokenType#COMMENT} tokens so the parser can turn them
 * into statements.
 */
public final class Lexer {
    private final String input;
    private int pos;
    private int line = 1;
    private int lineStart;

    public Lexer(String input) {
        this.input = input;
    }

    public List<Token> tokenize() {
        if (!input.isEmpty() && input.charAt(0) == '\uFEFF')
            throw new SyntaxException("Source must not start with a byte-order mark", span(0, 1));
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token t = next();
            tokens.add(t);
            if (t.is(TokenType.EOF))
                return tokens;
        }
    }

    private Token next() {
        skipBlanks();
        if (pos >= input.length())
            return new Token(TokenType.EOF, "", span(pos, 0));
        int start = pos;
        char c = input.charAt(pos);

        if (c == '\n') {
            pos++;
            Token t = new Token(TokenType.NEWLINE, "\n", span(start, 1));
            line++;
            lineStart = pos;
            return t;
        }
        if (c == '/' && peekAt(1) == '/') {
            pos += 2;
            while (pos < input.length() && input.charAt(pos) != '\n')
                pos++;
            return new Token(TokenType.COMMENT, input.substring(start + 2, pos).trim(), span(start, pos - start));
        }
        if (c == '"')
            return scanString();
        if (isDigit(c))
            return scanNumber();
        if (isIdentStart(c))
            return scanWord();
        return scanSymbol();
    }

    private static boolean isIdentStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void skipBlanks() {
        while (pos < input.length() && " \t\r".indexOf(input.charAt(pos)) >= 0)
            pos++;
    }

    private Token scanWord() {
        int start = pos;
        while (pos < input.length() && isIdentPart(input.charAt(pos)))
            pos++;
        String word = input.substring(start, pos);
        TokenType kw = TokenType.keyword(word);
        return new Token(kw != null ? kw : TokenType.IDENT, word, span(start, pos - start));
    }

    private Token scanNumber() {
        int start = pos;
        while (pos < input.length() && isDigit(input.charAt(pos)))
            pos++;
        // "0..5" is a range, so a dot only starts a fraction when a digit follows it
        if (pos + 1 < input.length() && input.charAt(pos) == '.' && isDigit(input.charAt(pos + 1))) {
            pos++;
            while (pos < input.length() && isDigit(input.charAt(pos)))
                pos++;
            return new Token(TokenType.FLOAT, input.substring(start, pos), span(start, pos - start));
        }
        return new Token(TokenType.INT, input.substring(start, pos), span(start, pos - start));
    }

    private Token scanString() {
        int start = pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '"')
                return new Token(TokenType.STRING, sb.toString(), span(start, pos - start));
            if (c == '\n')
                break;
            if (c == '\\') {
                if (pos >= input.length())
                    break;
                char e = input.charAt(pos++);
                switch (e) {
                    case '"', '\\' -> sb.append(e);
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> throw new SyntaxException("Unknown escape '\\" + e + "'", span(pos - 2, 2));
                }
            } else
                sb.append(c);
        }
        throw new SyntaxException("Unterminated string literal", span(start, pos - start));
    }

    private Token scanSymbol() {
        int start = pos;
        char c = input.charAt(pos);
        char n = peekAt(1);
        TokenType type = switch (c) {
            case '=' -> n == '=' ? TokenType.EQ : TokenType.ASSIGN;
            case '-' -> n == '>' ? TokenType.ARROW : TokenType.MINUS;
            case '+' -> TokenType.PLUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '&' -> n == '&' ? TokenType.AND_AND : TokenType.AMP;
            case '|' -> n == '|' ? TokenType.PIPE_PIPE : TokenType.PIPE;
            case '^' -> TokenType.CARET;
            case '!' -> n == '=' ? TokenType.NE : TokenType.BANG;
            case '~' -> TokenType.TILDE;
            case '<' -> {
                if (n == '<')
                    yield TokenType.SHL;
                if (n == '=')
                    yield peekAt(2) == '>' ? TokenType.SPACESHIP : TokenType.LE;
                yield TokenType.LT;
            }
            case '>' -> n == '>' ? TokenType.SHR : n == '=' ? TokenType.GE : TokenType.GT;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case ':' -> TokenType.COLON;
            case '.' -> n == '.' ? TokenType.DOT_DOT : TokenType.DOT;
            case '#' -> TokenType.HASH;
            default -> throw new SyntaxException("Unexpected character '" + c + "'", span(start, 1));
        };
        pos += type.text().length();
        return new Token(type, type.text(), span(start, pos - start));
    }

    private char peekAt(int ahead) {
        int i = pos + ahead;
        return i < input.length() ? input.charAt(i) : '\0';
    }

    private SourceSpan span(int offset, int length) {
        return new SourceSpan(line, offset - lineStart + 1, offset, length);
    }
}
