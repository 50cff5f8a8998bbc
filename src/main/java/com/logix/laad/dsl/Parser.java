package com.logix.laad.dsl;

import com.logix.laad.dsl.Ast.*;
import com.logix.laad.error.SyntaxException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser producing an {@link Ast.Program}.
 *
 * <p>
 * Binary operators are parsed by precedence climbing over {@link #LEVELS}, lowest
 * precedence first; every level is left-associative so {@code a - b - c} groups as
 * {@code (a - b) - c}. Casts bind tighter than any binary operator and chain to the
 * left.
 *
 * <p>
 * A conditional that spans more than one line must be closed with {@code end} or
 * {@code endif}. A single-line conditional may omit the terminator.
 */
public final class Parser {
    private static final TokenType[][] LEVELS = {
            { TokenType.PIPE_PIPE },
            { TokenType.AND_AND },
            { TokenType.PIPE },
            { TokenType.CARET },
            { TokenType.AMP },
            { TokenType.EQ, TokenType.NE },
            { TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.SPACESHIP },
            { TokenType.SHL, TokenType.SHR },
            { TokenType.PLUS, TokenType.MINUS },
            { TokenType.STAR, TokenType.SLASH, TokenType.PERCENT },
    };

    private final List<Token> tokens;
    private int pos;
    // set when a '>>' token closed an inner type argument and still owes one '>'
    private boolean pendingAngle;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Tokenizes and parses {@code source} in one step. */
    public static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseProgram();
    }

    public Program parseProgram() {
        List<Statement> statements = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (peek().is(TokenType.EOF))
                return new Program(statements);
            statements.add(parseStatement(false));
            expectStatementEnd(false);
        }
    }

    // ── Statements ──────────────────────────────────────────────────

    private Statement parseStatement(boolean inBlock) {
        Token t = peek();
        switch (t.type()) {
            case COMMENT:
                advance();
                return new Comment(t.text(), t.span());
            case IMPORT:
                if (inBlock)
                    throw error("'import' is only allowed at the top level", t);
                return parseImport();
            case HASH:
                return parseAttributedDef();
            default:
                break;
        }
        if (t.is(TokenType.IDENT) && (peekAt(1).is(TokenType.ASSIGN) || peekAt(1).is(TokenType.COLON)))
            return parseNodeDef(List.of());

        Expression e = parseChain();
        if (!(e instanceof Connection || e instanceof IfExpr || e instanceof WhileLoop || e instanceof RangeFor
                || e instanceof GenericFor))
            throw new SyntaxException("Expression statement has no effect; expected a connection using '->'",
                    e.span());
        return new ConnectionStatement(e, e.span());
    }

    private Import parseImport() {
        Token kw = expect(TokenType.IMPORT);
        List<String> path = parsePath();
        String alias = null;
        if (accept(TokenType.AS))
            alias = expect(TokenType.IDENT).text();
        return new Import(path, alias, kw.span().to(previous().span()));
    }

    private NodeDef parseAttributedDef() {
        List<AttributeDecl> attributes = new ArrayList<>();
        while (peek().is(TokenType.HASH)) {
            attributes.add(parseAttribute());
            skipNewlines();
        }
        if (!(peek().is(TokenType.IDENT)
                && (peekAt(1).is(TokenType.ASSIGN) || peekAt(1).is(TokenType.COLON))))
            throw error("Attributes must be followed by a node definition", peek());
        return parseNodeDef(attributes);
    }

    private AttributeDecl parseAttribute() {
        Token hash = expect(TokenType.HASH);
        expect(TokenType.LBRACKET);
        String key = expect(TokenType.IDENT).text();
        Map<String, Object> args = new LinkedHashMap<>();
        if (accept(TokenType.LPAREN)) {
            if (!peek().is(TokenType.RPAREN)) {
                do {
                    Token name = expect(TokenType.IDENT);
                    expect(TokenType.ASSIGN);
                    if (args.put(name.text(), parseConstant()) != null)
                        throw error("Duplicate attribute argument '" + name.text() + "'", name);
                } while (accept(TokenType.COMMA));
            }
            expect(TokenType.RPAREN);
        }
        expect(TokenType.RBRACKET);
        return new AttributeDecl(key, args, hash.span().to(previous().span()));
    }

    private Object parseConstant() {
        boolean negative = accept(TokenType.MINUS);
        Token t = advance();
        Object value = switch (t.type()) {
            case INT -> parseLong(t, negative);
            case FLOAT -> negative ? -Double.parseDouble(t.text()) : Double.parseDouble(t.text());
            case STRING -> t.text();
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case NULL -> null;
            default -> throw error("Expected a literal, found " + t, t);
        };
        if (negative && !(value instanceof Number))
            throw error("'-' only applies to numbers", t);
        return value;
    }

    private NodeDef parseNodeDef(List<AttributeDecl> attributes) {
        Token name = expect(TokenType.IDENT);
        TypeName annotation = null;
        if (accept(TokenType.COLON))
            annotation = parseType();
        expect(TokenType.ASSIGN);
        Binding binding;
        if (peek().is(TokenType.CLASS))
            binding = parseClassDef();
        else if (isWholeNodePath())
            binding = parseNodePath();
        else
            binding = parseChain();
        return new NodeDef(name.text(), annotation, List.copyOf(attributes), binding,
                name.span().to(previous().span()));
    }

    /** True when the rest of the statement is {@code ident ('.' ident)+}. */
    private boolean isWholeNodePath() {
        int i = 0;
        if (!peekAt(i).is(TokenType.IDENT))
            return false;
        int segments = 1;
        i++;
        while (peekAt(i).is(TokenType.DOT) && peekAt(i + 1).is(TokenType.IDENT)) {
            i += 2;
            segments++;
        }
        return segments >= 2 && isStatementEnd(peekAt(i));
    }

    private NodePath parseNodePath() {
        Token first = peek();
        List<String> path = parsePath();
        return new NodePath(path, first.span().to(previous().span()));
    }

    private ClassDef parseClassDef() {
        Token kw = expect(TokenType.CLASS);
        String className = null;
        if (peek().is(TokenType.IDENT))
            className = String.join(".", parsePath());
        expect(TokenType.LBRACE);
        List<PortDecl> ports = new ArrayList<>();
        skipNewlines();
        while (!peek().is(TokenType.RBRACE)) {
            Token dir = advance();
            if (!dir.is(TokenType.IN) && !dir.is(TokenType.OUT))
                throw error("Expected 'in' or 'out' port declaration, found " + dir, dir);
            Token portName = expect(TokenType.IDENT);
            expect(TokenType.COLON);
            TypeName type = parseType();
            ports.add(new PortDecl(dir.is(TokenType.IN), portName.text(), type, dir.span().to(previous().span())));
            skipNewlines();
            if (accept(TokenType.COMMA))
                skipNewlines();
            else if (!peek().is(TokenType.RBRACE))
                throw error("Expected ',' or '}' in class definition, found " + peek(), peek());
        }
        expect(TokenType.RBRACE);
        if (ports.isEmpty())
            throw new SyntaxException("A class must declare at least one port", kw.span());
        return new ClassDef(className, ports, kw.span().to(previous().span()));
    }

    private TypeName parseType() {
        Token name = expect(TokenType.IDENT);
        TypeName argument = null;
        if (accept(TokenType.LT)) {
            argument = parseType();
            closeAngle();
        }
        return new TypeName(name.text(), argument, name.span().to(previous().span()));
    }

    private void closeAngle() {
        if (pendingAngle) {
            pendingAngle = false;
            return;
        }
        if (accept(TokenType.GT))
            return;
        if (accept(TokenType.SHR)) {
            pendingAngle = true;
            return;
        }
        throw error("Expected '>' to close type argument, found " + peek(), peek());
    }

    private List<String> parsePath() {
        List<String> path = new ArrayList<>();
        path.add(expect(TokenType.IDENT).text());
        while (peek().is(TokenType.DOT) && peekAt(1).is(TokenType.IDENT)) {
            advance();
            path.add(advance().text());
        }
        return path;
    }

    private Block parseBlock() {
        Token open = expect(TokenType.LBRACE);
        List<Statement> statements = new ArrayList<>();
        while (true) {
            skipNewlines();
            if (accept(TokenType.RBRACE))
                return new Block(statements, open.span().to(previous().span()));
            if (peek().is(TokenType.EOF))
                throw error("Unclosed block, expected '}'", peek());
            statements.add(parseStatement(true));
            expectStatementEnd(true);
        }
    }

    // ── Expressions ─────────────────────────────────────────────────

    private Expression parseChain() {
        Expression first = parseFlow();
        if (!arrowAhead())
            return first;
        List<Expression> chain = new ArrayList<>();
        chain.add(first);
        while (arrowAhead()) {
            skipNewlines();
            expect(TokenType.ARROW);
            skipNewlines();
            chain.add(parseFlow());
        }
        return new Connection(List.copyOf(chain), first.span().to(previous().span()));
    }

    /** An arrow on this line, or at the start of the next non-blank line. */
    private boolean arrowAhead() {
        int i = 0;
        while (peekAt(i).is(TokenType.NEWLINE))
            i++;
        return peekAt(i).is(TokenType.ARROW);
    }

    private Expression parseFlow() {
        return switch (peek().type()) {
            case IF -> parseIf();
            case WHILE -> parseWhile();
            case FOR -> parseFor();
            default -> parseBinary(0);
        };
    }

    private Expression parseIf() {
        Token ifToken = expect(TokenType.IF);
        List<Expression> conditions = new ArrayList<>();
        List<Expression> branches = new ArrayList<>();
        Expression elseBranch = null;

        conditions.add(parseCondition());
        branches.add(parseBranch());
        while (true) {
            int mark = pos;
            skipNewlines();
            if (accept(TokenType.ELSEIF)) {
                conditions.add(parseCondition());
                branches.add(parseBranch());
            } else if (accept(TokenType.ELSE)) {
                elseBranch = parseBranch();
                break;
            } else {
                pos = mark;
                break;
            }
        }

        Token last = previous();
        int mark = pos;
        skipNewlines();
        boolean terminated = accept(TokenType.END) || accept(TokenType.ENDIF);
        if (!terminated) {
            pos = mark;
            if (last.span().line() > ifToken.span().line())
                throw error("Conditional spanning several lines must be closed with 'end'", peek());
        }
        return new IfExpr(List.copyOf(conditions), List.copyOf(branches), elseBranch, terminated,
                ifToken.span().to(previous().span()));
    }

    private Expression parseCondition() {
        skipNewlines();
        Expression condition = parseBinary(0);
        skipNewlines();
        expect(TokenType.THEN);
        return condition;
    }

    private Expression parseBranch() {
        skipNewlines();
        return parseBinary(0);
    }

    private Expression parseWhile() {
        Token kw = expect(TokenType.WHILE);
        expect(TokenType.LPAREN);
        skipNewlines();
        Expression condition = parseBinary(0);
        skipNewlines();
        expect(TokenType.RPAREN);
        skipNewlines();
        Block body = parseBlock();
        return new WhileLoop(condition, body, kw.span().to(previous().span()));
    }

    private Expression parseFor() {
        Token kw = expect(TokenType.FOR);
        expect(TokenType.LPAREN);
        skipNewlines();
        if (peek().is(TokenType.IDENT) && peekAt(1).is(TokenType.IN)) {
            String variable = advance().text();
            advance();
            Expression from = parseBinary(0);
            expect(TokenType.DOT_DOT);
            Expression to = parseBinary(0);
            skipNewlines();
            expect(TokenType.RPAREN);
            skipNewlines();
            Block body = parseBlock();
            return new RangeFor(variable, from, to, body, kw.span().to(previous().span()));
        }
        Expression start = parseChain();
        expect(TokenType.COMMA);
        skipNewlines();
        Expression condition = parseBinary(0);
        expect(TokenType.COMMA);
        skipNewlines();
        Expression step = parseChain();
        skipNewlines();
        expect(TokenType.RPAREN);
        skipNewlines();
        Block body = parseBlock();
        return new GenericFor(start, condition, step, body, kw.span().to(previous().span()));
    }

    private Expression parseBinary(int level) {
        if (level == LEVELS.length)
            return parseUnary();
        Expression left = parseBinary(level + 1);
        while (matchesAny(peek().type(), LEVELS[level])) {
            Token op = advance();
            skipNewlines();
            Expression right = parseBinary(level + 1);
            left = new BinaryOp(BinaryOperator.of(op.type()), left, right, left.span().to(right.span()));
        }
        return left;
    }

    private Expression parseUnary() {
        Token t = peek();
        if (t.is(TokenType.MINUS) && (peekAt(1).is(TokenType.INT) || peekAt(1).is(TokenType.FLOAT))) {
            advance();
            Token number = advance();
            Literal literal = number.is(TokenType.INT)
                    ? new Literal(LiteralKind.INT, parseLong(number, true), t.span().to(number.span()))
                    : new Literal(LiteralKind.FLOAT, -Double.parseDouble(number.text()), t.span().to(number.span()));
            return parseCasts(literal);
        }
        UnaryOperator op = switch (t.type()) {
            case MINUS -> UnaryOperator.NEGATE;
            case BANG -> UnaryOperator.NOT;
            case TILDE -> UnaryOperator.BIT_NOT;
            default -> null;
        };
        if (op == null)
            return parseCasts(parsePrimary());
        advance();
        Expression operand = parseUnary();
        return new UnaryOp(op, operand, t.span().to(operand.span()));
    }

    private Expression parseCasts(Expression value) {
        while (accept(TokenType.AS)) {
            TypeName target = parseType();
            value = new Cast(value, target, value.span().to(target.span()));
        }
        return value;
    }

    private Expression parsePrimary() {
        Token t = advance();
        switch (t.type()) {
            case INT:
                return new Literal(LiteralKind.INT, parseLong(t, false), t.span());
            case FLOAT:
                return new Literal(LiteralKind.FLOAT, Double.parseDouble(t.text()), t.span());
            case STRING:
                return new Literal(LiteralKind.STRING, t.text(), t.span());
            case TRUE:
                return new Literal(LiteralKind.BOOL, Boolean.TRUE, t.span());
            case FALSE:
                return new Literal(LiteralKind.BOOL, Boolean.FALSE, t.span());
            case NULL:
                return new Literal(LiteralKind.NULL, null, t.span());
            case IDENT: {
                pos--;
                List<String> path = parsePath();
                return new NodeRef(List.copyOf(path), t.span().to(previous().span()));
            }
            case LPAREN: {
                skipNewlines();
                Expression inner = parseChain();
                skipNewlines();
                expect(TokenType.RPAREN);
                return inner;
            }
            case MATCH:
            case WEND:
                throw error("'" + t.text() + "' is reserved for future use", t);
            default:
                throw error("Expected an expression, found " + t, t);
        }
    }

    private static long parseLong(Token t, boolean negative) {
        try {
            return Long.parseLong(negative ? "-" + t.text() : t.text());
        } catch (NumberFormatException e) {
            throw new SyntaxException("Integer literal out of range: " + t.text(), t.span());
        }
    }

    // ── Token plumbing ──────────────────────────────────────────────

    private void expectStatementEnd(boolean inBlock) {
        Token t = peek();
        if (t.is(TokenType.NEWLINE) || t.is(TokenType.EOF) || t.is(TokenType.COMMENT))
            return;
        if (inBlock && t.is(TokenType.RBRACE))
            return;
        throw error("Expected end of statement, found " + t, t);
    }

    private static boolean isStatementEnd(Token t) {
        return t.is(TokenType.NEWLINE) || t.is(TokenType.EOF) || t.is(TokenType.COMMENT) || t.is(TokenType.RBRACE);
    }

    private static boolean matchesAny(TokenType type, TokenType[] candidates) {
        for (TokenType c : candidates)
            if (c == type)
                return true;
        return false;
    }

    private void skipNewlines() {
        while (peek().is(TokenType.NEWLINE))
            pos++;
    }

    private Token peek() {
        return tokens.get(Math.min(pos, tokens.size() - 1));
    }

    private Token peekAt(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(Math.max(pos - 1, 0));
    }

    private Token advance() {
        Token t = peek();
        if (!t.is(TokenType.EOF))
            pos++;
        return t;
    }

    private boolean accept(TokenType type) {
        if (peek().is(type)) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(TokenType type) {
        Token t = peek();
        if (!t.is(type))
            throw error("Expected " + type.describe() + ", found " + t, t);
        pos++;
        return t;
    }

    private static SyntaxException error(String message, Token at) {
        return new SyntaxException(message, at.span());
    }
}
