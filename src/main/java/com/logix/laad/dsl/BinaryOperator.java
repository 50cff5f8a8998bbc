package com.logix.laad.dsl;

/** Binary operators, each lowered to one {@code logix.operators.*} node. */
public enum BinaryOperator {
    OR("||", "or"),
    AND("&&", "and"),
    BIT_OR("|", "bitwise_or"),
    BIT_XOR("^", "bitwise_xor"),
    BIT_AND("&", "bitwise_and"),
    EQ("==", "equals"),
    NE("!=", "not_equals"),
    LT("<", "less"),
    LE("<=", "less_or_equal"),
    GT(">", "greater"),
    GE(">=", "greater_or_equal"),
    CMP("<=>", "compare"),
    SHL("<<", "shift_left"),
    SHR(">>", "shift_right"),
    ADD("+", "add"),
    SUB("-", "sub"),
    MUL("*", "mul"),
    DIV("/", "div"),
    MOD("%", "mod");

    private final String symbol;
    private final String templatePath;

    BinaryOperator(String symbol, String name) {
        this.symbol = symbol;
        this.templatePath = "logix.operators." + name;
    }

    public String symbol() {
        return symbol;
    }

    public String templatePath() {
        return templatePath;
    }

    /** Maps an operator token to its operator, or {@code null}. */
    public static BinaryOperator of(TokenType t) {
        return switch (t) {
            case PIPE_PIPE -> OR;
            case AND_AND -> AND;
            case PIPE -> BIT_OR;
            case CARET -> BIT_XOR;
            case AMP -> BIT_AND;
            case EQ -> EQ;
            case NE -> NE;
            case LT -> LT;
            case LE -> LE;
            case GT -> GT;
            case GE -> GE;
            case SPACESHIP -> CMP;
            case SHL -> SHL;
            case SHR -> SHR;
            case PLUS -> ADD;
            case MINUS -> SUB;
            case STAR -> MUL;
            case SLASH -> DIV;
            case PERCENT -> MOD;
            default -> null;
        };
    }
}
