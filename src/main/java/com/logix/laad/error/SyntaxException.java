package com.logix.laad.error;

import com.logix.laad.dsl.SourceSpan;

/** Malformed tokens, unexpected input or an unterminated multi-line conditional. */
public class SyntaxException extends CompilationException {

    public SyntaxException(String detail, SourceSpan span) {
        super(Stage.PARSE, detail, span);
    }
}
