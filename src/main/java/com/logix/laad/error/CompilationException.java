package com.logix.laad.error;

import com.logix.laad.dsl.SourceSpan;

/**
 * Base class of every fatal compilation error.
 *
 * <p>
 * A compilation unit stops at the first instance thrown; no later stage runs and
 * nothing is emitted. The message is prefixed with the source position when one is
 * known.
 */
public class CompilationException extends RuntimeException {
    private final Stage stage;
    private final SourceSpan span;
    private final String detail;

    public CompilationException(Stage stage, String detail, SourceSpan span) {
        super(format(detail, span));
        this.stage = stage;
        this.span = span;
        this.detail = detail;
    }

    public Stage getStage() {
        return stage;
    }

    /** Source position of the error, or {@code null} for synthetic graph elements. */
    public SourceSpan getSpan() {
        return span;
    }

    /** The message without the position prefix. */
    public String getDetail() {
        return detail;
    }

    private static String format(String detail, SourceSpan span) {
        return span == null ? detail : span + ": " + detail;
    }
}
