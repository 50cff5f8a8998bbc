package com.logix.laad.dsl;

public enum UnaryOperator {
    NEGATE("-", "negate"),
    NOT("!", "not"),
    BIT_NOT("~", "bitwise_not");

    private final String symbol;
    private final String templatePath;

    UnaryOperator(String symbol, String name) {
        this.symbol = symbol;
        this.templatePath = "logix.operators." + name;
    }

    public String symbol() {
        return symbol;
    }

    public String templatePath() {
        return templatePath;
    }
}
