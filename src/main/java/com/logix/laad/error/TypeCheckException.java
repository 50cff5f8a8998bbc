package com.logix.laad.error;

import com.logix.laad.dsl.SourceSpan;

/**
 * Unification failure, impossible cast or invalid operand type.
 *
 * <p>
 * When the failure happened on a connection, {@link #getSite()} names both ports
 * ({@code "a.value -> b.input"}) and {@link #getLeft()}/{@link #getRight()} hold the
 * two conflicting types as rendered by the type printer.
 */
public class TypeCheckException extends CompilationException {
    private final String site;
    private final String left;
    private final String right;

    public TypeCheckException(String detail, SourceSpan span) {
        this(Stage.INFER, detail, span, null, null, null);
    }

    public TypeCheckException(Stage stage, String detail, SourceSpan span) {
        this(stage, detail, span, null, null, null);
    }

    public TypeCheckException(String detail, SourceSpan span, String site, String left, String right) {
        this(Stage.INFER, detail, span, site, left, right);
    }

    private TypeCheckException(Stage stage, String detail, SourceSpan span, String site, String left, String right) {
        super(stage, detail, span);
        this.site = site;
        this.left = left;
        this.right = right;
    }

    public String getSite() {
        return site;
    }

    public String getLeft() {
        return left;
    }

    public String getRight() {
        return right;
    }
}
